package com.serge.scheduler.service;

import com.serge.scheduler.domain.Event;
import com.serge.scheduler.error.BadInputException;
import com.serge.scheduler.error.ForbiddenException;
import com.serge.scheduler.error.Messages;
import com.serge.scheduler.error.ValidationException;
import com.serge.scheduler.input.EventFilterInput;
import com.serge.scheduler.input.EventInput;
import com.serge.scheduler.store.EventDraft;
import com.serge.scheduler.store.EventFilter;
import com.serge.scheduler.store.EventStore;
import com.serge.scheduler.store.PopulatedEvent;
import com.serge.scheduler.validation.InputValidator;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {
    @Mock
    private EventStore eventStore;

    private EventService eventService;

    @BeforeEach
    void setUp() {
        InputValidator validator = new InputValidator(Validation.buildDefaultValidatorFactory().getValidator());
        eventService = new EventService(eventStore, new OwnershipGuard(), validator);
    }

    private static Event concert() {
        return Event.builder().id("e1").title("Concert").date(Instant.parse("2025-03-01T19:00:00Z"))
                .price(25).createdBy("alice").build();
    }

    @Test
    void createPassesTheParsedDraftToTheStore() {
        when(eventStore.create(any(EventDraft.class), eq("alice"))).thenReturn(new PopulatedEvent(concert(), null));

        eventService.create("alice", new EventInput("Concert", null, "2025-03-01T19:00:00Z", 25.0));

        ArgumentCaptor<EventDraft> draft = ArgumentCaptor.forClass(EventDraft.class);
        verify(eventStore).create(draft.capture(), eq("alice"));
        assertThat(draft.getValue().getDate()).isEqualTo(Instant.parse("2025-03-01T19:00:00Z"));
        assertThat(draft.getValue().getPrice()).isEqualTo(25.0);
    }

    @Test
    void negativePriceNeverReachesTheStore() {
        assertThatThrownBy(() -> eventService.create("alice", new EventInput("Concert", null, "2025-03-01", -5.0)))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(eventStore);
    }

    @Test
    void updateByNonCreatorIsForbidden() {
        when(eventStore.findById("e1")).thenReturn(Optional.of(concert()));

        assertThatThrownBy(() -> eventService.update("bob", "e1", new EventInput("Mine", null, "2025-03-01", 1.0)))
                .isInstanceOf(ForbiddenException.class);
        verify(eventStore, never()).updateIfOwner(anyString(), anyString(), any());
    }

    @Test
    void deleteByNonCreatorIsForbidden() {
        when(eventStore.findById("e1")).thenReturn(Optional.of(concert()));

        assertThatThrownBy(() -> eventService.delete("bob", "e1")).isInstanceOf(ForbiddenException.class);
        verify(eventStore, never()).deleteIfOwner(anyString(), anyString());
    }

    @Test
    void updateOfMissingEventIsBadInput() {
        when(eventStore.findById("gone")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> eventService.update("alice", "gone", new EventInput("X", null, "2025-03-01", 1.0)))
                .isInstanceOf(BadInputException.class)
                .hasMessage(Messages.EVENT_NOT_FOUND);
    }

    @Test
    void deleteOfMissingEventReturnsFalse() {
        when(eventStore.findById("gone")).thenReturn(Optional.empty());

        assertThat(eventService.delete("alice", "gone")).isFalse();
        verify(eventStore, never()).deleteIfOwner(anyString(), anyString());
    }

    @Test
    void filterIsParsedIntoInclusiveBounds() {
        when(eventStore.listFiltered(any(EventFilter.class))).thenReturn(List.of());

        eventService.list(new EventFilterInput(null, "2025-03-01", "2025-03-31T23:59:59Z"));

        ArgumentCaptor<EventFilter> filter = ArgumentCaptor.forClass(EventFilter.class);
        verify(eventStore).listFiltered(filter.capture());
        assertThat(filter.getValue().getCreatedById()).isNull();
        assertThat(filter.getValue().getDateFrom()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(filter.getValue().getDateTo()).isEqualTo(Instant.parse("2025-03-31T23:59:59Z"));
    }
}
