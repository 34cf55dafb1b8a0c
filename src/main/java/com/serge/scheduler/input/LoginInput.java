package com.serge.scheduler.input;

import com.serge.scheduler.validation.Patterns;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginInput {
    @NotNull(message = Patterns.EMAIL_INVALID)
    @Pattern(regexp = Patterns.EMAIL, message = Patterns.EMAIL_INVALID)
    private String email;

    @NotNull(message = Patterns.PASSWORD_MIN)
    @Size(min = 8, message = Patterns.PASSWORD_MIN)
    private String password;
}
