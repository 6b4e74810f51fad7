package com.techStack.courseHub.config.core;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fields a profile update may touch. {@code uid} is always removed, whatever is configured.
 */
@Getter
@ConfigurationProperties(prefix = "users")
public class UserProfileProperties {

    private final Set<String> allowedUpdateFields;

    public UserProfileProperties(
            @DefaultValue({"role", "firstName", "lastName", "email", "facultyId", "programId", "branchId", "year"})
            List<String> allowedUpdateFields) {
        Set<String> fields = new LinkedHashSet<>(allowedUpdateFields);
        fields.remove("uid");
        this.allowedUpdateFields = Collections.unmodifiableSet(fields);
    }
}
