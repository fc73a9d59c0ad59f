package com.salonhub.authservice.dto.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    @Size(max = 100)
    private String email;

    @NotBlank(message = "Password is required")
    @Size(max = 128)
    private String password;

    // needed only when the email is registered in more than one tenant
    @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "Tenant id has an invalid format")
    @Size(max = 64)
    private String tenantId;
}
