package com.serge.scheduler.input;

import com.serge.scheduler.domain.Role;
import com.serge.scheduler.validation.ImageReference;
import com.serge.scheduler.validation.Patterns;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserInput {
    @NotBlank(message = Patterns.NAME_REQUIRED)
    @Size(min = 2, message = Patterns.NAME_MIN)
    @Size(max = 50, message = Patterns.NAME_MAX)
    @Pattern(regexp = Patterns.NAME, message = Patterns.NAME_PATTERN)
    private String name;

    @NotNull(message = Patterns.EMAIL_INVALID)
    @Pattern(regexp = Patterns.EMAIL, message = Patterns.EMAIL_INVALID)
    private String email;

    @ImageReference
    private String imageUrl;

    private Role role = Role.USER;
}
