package com.serge.scheduler.web.dto;

import com.serge.scheduler.store.UserPage;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class UsersResultDto {
    List<UserDto> usersList;
    long total;
    boolean hasMore;

    public static UsersResultDto from(UserPage page) {
        return new UsersResultDto(
                page.getUsers().stream().map(UserDto::from).collect(Collectors.toList()),
                page.getTotal(),
                page.isHasMore());
    }
}
