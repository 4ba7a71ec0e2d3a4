package com.demo.chathub.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticatedUser {
    private long id;
    private String publicId;
    private String email;
    private String displayName;
    private Instant tokenExpiresAt;
}
