package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.model.DogRoster;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Loads the dogs from the YAML roster. The order in the file is kept and is
 * the tie-break order for load balancing.
 */
@Service
public class DogRosterService {

    private static final Logger log = LoggerFactory.getLogger(DogRosterService.class);

    @Value("${dogwalker.dogs.path:config/dogs.yaml}")
    private String rosterPath;

    private final ObjectMapper yamlMapper;
    private volatile List<Dog> dogs = List.of();

    public DogRosterService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setRosterPath(String path) {
        this.rosterPath = path;
    }

    @PostConstruct
    public void loadDogs() {
        File rosterFile = new File(rosterPath);
        if (!rosterFile.isFile()) {
            log.warn("Dog roster not found at {}; no dogs can take tasks", rosterPath);
            dogs = List.of();
            return;
        }

        try {
            DogRoster roster = yamlMapper.readValue(rosterFile, DogRoster.class);
            dogs = validated(roster.getDogs());
            log.info("Loaded {} dog(s) from {}", dogs.size(), rosterPath);
        } catch (IOException e) {
            log.error("Failed to load dog roster from {}: {}", rosterPath, e.getMessage());
            dogs = List.of();
        }
    }

    public void replaceDogs(List<Dog> replacement) {
        dogs = validated(replacement);
    }

    public List<Dog> getDogs() {
        return dogs;
    }

    public Optional<Dog> findDog(String name) {
        return dogs.stream().filter(dog -> dog.getName().equals(name)).findFirst();
    }

    private List<Dog> validated(List<Dog> candidates) {
        if (candidates == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<Dog> result = new ArrayList<>();
        for (Dog dog : candidates) {
            if (dog == null || dog.getName() == null || dog.getName().isBlank()) {
                log.warn("Skipping roster entry without a name");
                continue;
            }
            if (!seen.add(dog.getName())) {
                log.warn("Skipping duplicate roster entry for {}", dog.getName());
                continue;
            }
            result.add(dog);
        }
        return List.copyOf(result);
    }
}
