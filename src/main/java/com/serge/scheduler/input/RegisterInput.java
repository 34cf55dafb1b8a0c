package com.serge.scheduler.input;

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
public class RegisterInput {
    @NotBlank(message = Patterns.NAME_REQUIRED)
    @Size(min = 2, message = Patterns.NAME_MIN)
    @Size(max = 50, message = Patterns.NAME_MAX)
    @Pattern(regexp = Patterns.NAME, message = Patterns.NAME_PATTERN)
    private String name;

    @NotNull(message = Patterns.EMAIL_INVALID)
    @Pattern(regexp = Patterns.EMAIL, message = Patterns.EMAIL_INVALID)
    private String email;

    @NotNull(message = Patterns.PASSWORD_MIN)
    @Size(min = 8, message = Patterns.PASSWORD_MIN)
    @Pattern(regexp = Patterns.PASSWORD, message = Patterns.PASSWORD_COMPLEXITY)
    private String password;
}
