package com.jijue.hospital_api.model;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Login account. Patients and doctors keep their clinical data in their own
 * documents; {@code profileId} points at that document and {@code code} repeats
 * its business id (PAT... / DOC...) so tokens can carry it.
 */
@Document("users")
public class User implements UserDetails {
    @Id
    private String id;
    @Indexed(unique = true)
    private String username;
    @JsonIgnore
    private String password;
    private Role role;
    private boolean enabled = true;
    private String profileId;
    private String code;
    private String firstName;
    private String lastName;
    private Instant lastLogin;
    private Instant createdAt;

    public User() {}

    public User(String username, String password, Role role) {
        this.username = username;
        this.password = password;
        this.role = role;
    }

    // Getters
    public String getId() { return id; }
    @Override
    public String getUsername() { return username; }
    @Override
    public String getPassword() { return password; }
    public Role getRole() { return role; }
    @Override
    public boolean isEnabled() { return enabled; }
    public String getProfileId() { return profileId; }
    public String getCode() { return code; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public Instant getLastLogin() { return lastLogin; }
    public Instant getCreatedAt() { return createdAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setUsername(String username) { this.username = username; }
    public void setPassword(String password) { this.password = password; }
    public void setRole(Role role) { this.role = role; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public void setProfileId(String profileId) { this.profileId = profileId; }
    public void setCode(String code) { this.code = code; }
    public void setFirstName(String firstName) { this.firstName = firstName; }
    public void setLastName(String lastName) { this.lastName = lastName; }
    public void setLastLogin(Instant lastLogin) { this.lastLogin = lastLogin; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean hasRole(Role candidate) {
        return role == candidate;
    }

    // UserDetails
    @Override
    @JsonIgnore
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority(role.name()));
    }

    @Override
    @JsonIgnore
    public boolean isAccountNonExpired() { return true; }

    @Override
    @JsonIgnore
    public boolean isAccountNonLocked() { return true; }

    @Override
    @JsonIgnore
    public boolean isCredentialsNonExpired() { return true; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        if (id == null || user.id == null) {
            return false;
        }
        return Objects.equals(id, user.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
