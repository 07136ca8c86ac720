package com.graphqldemo.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    private String id;
    private String username;
    private String email;
    private String passwordHash;
    /** 角色取值：User / Admin */
    private String role;
    private Instant createdAt;
    private Instant updatedAt;
}
