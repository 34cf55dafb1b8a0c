package com.serge.scheduler.web;

import com.serge.scheduler.input.*;
import com.serge.scheduler.service.UserService;
import com.serge.scheduler.web.dto.EventDto;
import com.serge.scheduler.web.dto.UserDto;
import com.serge.scheduler.web.dto.UsersResultDto;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.*;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.stream.Collectors;

@Controller
@RequiredArgsConstructor
public class UserController {
    private final UserService userService;

    @QueryMapping
    public UserDto myProfile(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        return UserDto.from(userService.profile(Callers.require(callerId)));
    }

    @QueryMapping
    public UserDto user(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                        @Argument String id) {
        Callers.require(callerId);
        return userService.find(id).map(UserDto::from).orElse(null);
    }

    @QueryMapping
    public List<UserDto> users(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                               @Argument UsersWhere where,
                               @Argument UsersOrderBy orderBy,
                               @Argument PaginationInput pagination) {
        Callers.require(callerId);
        return userService.list(where, orderBy, pagination).stream().map(UserDto::from).collect(Collectors.toList());
    }

    @QueryMapping
    public UsersResultDto usersPage(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                    @Argument UsersWhere where,
                                    @Argument UsersOrderBy orderBy,
                                    @Argument PaginationInput pagination) {
        Callers.require(callerId);
        return UsersResultDto.from(userService.page(where, orderBy, pagination));
    }

    @MutationMapping
    public UserDto updateMyProfile(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                   @Argument UpdateProfileInput input) {
        return UserDto.from(userService.updateMyProfile(Callers.require(callerId), input));
    }

    @MutationMapping
    public UserDto createUser(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                              @Argument CreateUserInput input) {
        return UserDto.from(userService.createUser(Callers.require(callerId), input));
    }

    @MutationMapping
    public UserDto updateUser(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                              @Argument String id,
                              @Argument UpdateUserInput input) {
        return UserDto.from(userService.updateUser(Callers.require(callerId), id, input));
    }

    @MutationMapping
    public boolean deleteUser(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                              @Argument String id) {
        return userService.deleteUser(Callers.require(callerId), id);
    }

    @SchemaMapping(typeName = "User", field = "createdEvents")
    public List<EventDto> createdEvents(UserDto user) {
        return userService.createdEvents(user.getCreatedEventIds()).stream()
                .map(EventDto::from)
                .collect(Collectors.toList());
    }
}
