package com.serge.scheduler.input;

import com.serge.scheduler.store.ProfilePatch;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.IsoDateTime;
import com.serge.scheduler.validation.Patterns;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileInput {
    @Size(min = 2, message = Patterns.NAME_MIN)
    private String name;

    private String address;

    @IsoDateTime(message = "Invalid dob")
    private String dob;

    @URL(message = Patterns.INVALID_URL)
    private String imageUrl;

    public ProfilePatch toPatch() {
        return ProfilePatch.builder()
                .name(name == null ? null : name.trim())
                .address(address)
                .dob(DateTimes.parseDate(dob).orElse(null))
                .imageUrl(imageUrl)
                .build();
    }
}
