package com.serge.scheduler.store;

import com.serge.scheduler.domain.Role;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Sort;

@Value
@Builder
public class UserQuery {
    public enum SortField {
        NAME("name"), CREATED_AT("createdAt"), UPDATED_AT("updatedAt");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }
    }

    String search;
    Role role;
    @Builder.Default
    SortField sortField = SortField.NAME;
    @Builder.Default
    Sort.Direction direction = Sort.Direction.ASC;
    @Builder.Default
    int limit = 10;
    @Builder.Default
    int offset = 0;
}
