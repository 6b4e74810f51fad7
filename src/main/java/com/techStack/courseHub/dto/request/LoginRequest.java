package com.techStack.courseHub.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Login body. Credentials travel in the Authorization header, not here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {
    private String uid;
}
