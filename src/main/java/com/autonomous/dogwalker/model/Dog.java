package com.autonomous.dogwalker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dog {
    private String name;          // GitHub username, also the git author name
    private String displayName;
    private String email;
    private String credentialRef; // name of the env var holding this dog's token

    public String getDisplayNameOrName() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }
}
