package com.serge.scheduler.store;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ProfilePatch {
    String name;
    String address;
    LocalDate dob;
    String imageUrl;
}
