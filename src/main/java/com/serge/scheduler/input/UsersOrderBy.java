package com.serge.scheduler.input;

import com.serge.scheduler.store.UserQuery;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Sort;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsersOrderBy {
    private UserQuery.SortField field = UserQuery.SortField.NAME;
    private Sort.Direction direction = Sort.Direction.ASC;
}
