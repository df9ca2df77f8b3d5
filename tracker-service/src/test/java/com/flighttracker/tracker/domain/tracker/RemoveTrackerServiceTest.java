package com.flighttracker.tracker.domain.tracker;

import com.flighttracker.tracker.domain.exceptions.AmbiguousTrackerIdException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotFoundException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotOwnedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_OTHER_OWNER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_OWNER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_TRACKER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.rduToMiaTrackerBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

class RemoveTrackerServiceTest extends TrackerServiceBaseTest {

    @Test
    void shouldRemoveByExactId() {
        var tracker = rduToMiaTrackerBuilder().build();
        given(trackerRepository.findById(SOME_TRACKER_ID)).willReturn(Optional.of(tracker));
        given(trackerRepository.deleteById(SOME_TRACKER_ID)).willReturn(true);

        var removed = trackerService.removeTracker(SOME_OWNER_ID, SOME_TRACKER_ID);

        assertThat(removed.id()).isEqualTo(SOME_TRACKER_ID);
        then(trackersRemovedCounter).should().increment();
    }

    @Test
    void shouldRemoveByUniquePrefixCaseInsensitively() {
        var tracker = rduToMiaTrackerBuilder().build();
        given(trackerRepository.findByIdPrefix("01JTRACK")).willReturn(List.of(tracker));
        given(trackerRepository.deleteById(SOME_TRACKER_ID)).willReturn(true);

        var removed = trackerService.removeTracker(SOME_OWNER_ID, "01jtrack");

        assertThat(removed.id()).isEqualTo(SOME_TRACKER_ID);
    }

    @Test
    void shouldRejectAmbiguousPrefix() {
        var first = rduToMiaTrackerBuilder().build();
        var second = rduToMiaTrackerBuilder().id("01JTRACKER0000000000000002").build();
        given(trackerRepository.findByIdPrefix("01JTRACKER")).willReturn(List.of(first, second));

        assertThatThrownBy(() -> trackerService.removeTracker(SOME_OWNER_ID, "01JTRACKER"))
                .isInstanceOf(AmbiguousTrackerIdException.class);
        then(trackerRepository).should(never()).deleteById(any());
    }

    @Test
    void shouldRejectRemovalOfAnotherOwnersTracker() {
        given(trackerRepository.findById(SOME_TRACKER_ID)).willReturn(Optional.of(rduToMiaTrackerBuilder().build()));

        assertThatThrownBy(() -> trackerService.removeTracker(SOME_OTHER_OWNER_ID, SOME_TRACKER_ID))
                .isInstanceOf(TrackerNotOwnedException.class);
        then(trackerRepository).should(never()).deleteById(any());
    }

    @Test
    void shouldRejectRemovalOfAnotherOwnersTrackerByPrefix() {
        given(trackerRepository.findByIdPrefix("01JTRACK")).willReturn(List.of(rduToMiaTrackerBuilder().build()));

        assertThatThrownBy(() -> trackerService.removeTracker(SOME_OTHER_OWNER_ID, "01JTRACK"))
                .isInstanceOf(TrackerNotOwnedException.class);
        then(trackerRepository).should(never()).deleteById(any());
    }

    @Test
    void shouldPreferCallersTrackerWhenPrefixAlsoMatchesOtherOwners() {
        var mine = rduToMiaTrackerBuilder().build();
        var theirs = rduToMiaTrackerBuilder().id("01JTRACKER0000000000000002").ownerId(SOME_OTHER_OWNER_ID).build();
        given(trackerRepository.findByIdPrefix("01JTRACK")).willReturn(List.of(mine, theirs));
        given(trackerRepository.deleteById(SOME_TRACKER_ID)).willReturn(true);

        var removed = trackerService.removeTracker(SOME_OWNER_ID, "01JTRACK");

        assertThat(removed.id()).isEqualTo(SOME_TRACKER_ID);
    }

    @Test
    void shouldReportNotFoundForUnknownPrefix() {
        given(trackerRepository.findByIdPrefix("01JNOPE")).willReturn(List.of());

        assertThatThrownBy(() -> trackerService.removeTracker(SOME_OWNER_ID, "01jnope"))
                .isInstanceOf(TrackerNotFoundException.class);
    }

    @Test
    void shouldReportNotFoundWhenAlreadyRemoved() {
        given(trackerRepository.findById(SOME_TRACKER_ID)).willReturn(Optional.of(rduToMiaTrackerBuilder().build()));
        given(trackerRepository.deleteById(SOME_TRACKER_ID)).willReturn(false);

        assertThatThrownBy(() -> trackerService.removeTracker(SOME_OWNER_ID, SOME_TRACKER_ID))
                .isInstanceOf(TrackerNotFoundException.class);
        then(trackersRemovedCounter).should(never()).increment();
    }
}
