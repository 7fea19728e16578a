package com.autonomous.dogwalker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionEvent {
    private String text;
    private String requesterId;
    private String requesterDisplayName;
    private String channelId;
    private String threadTs;
}
