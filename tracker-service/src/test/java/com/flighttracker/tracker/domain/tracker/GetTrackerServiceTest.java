package com.flighttracker.tracker.domain.tracker;

import com.flighttracker.tracker.domain.exceptions.TrackerNotFoundException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotOwnedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_OTHER_OWNER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_OWNER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.SOME_TRACKER_ID;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.TODAY;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.rduToMiaTrackerBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

class GetTrackerServiceTest extends TrackerServiceBaseTest {

    @Test
    void shouldReturnOwnedTracker() {
        given(trackerRepository.findById(SOME_TRACKER_ID)).willReturn(Optional.of(rduToMiaTrackerBuilder().build()));

        assertThat(trackerService.getTracker(SOME_TRACKER_ID, SOME_OWNER_ID).origin()).isEqualTo("RDU");
    }

    @Test
    void shouldDistinguishForbiddenFromNotFound() {
        given(trackerRepository.findById(SOME_TRACKER_ID)).willReturn(Optional.of(rduToMiaTrackerBuilder().build()));

        assertThatThrownBy(() -> trackerService.getTracker(SOME_TRACKER_ID, SOME_OTHER_OWNER_ID))
                .isInstanceOf(TrackerNotOwnedException.class);
        assertThatThrownBy(() -> trackerService.getTracker("01JMISSING0000000000000000", SOME_OWNER_ID))
                .isInstanceOf(TrackerNotFoundException.class);
    }

    @Test
    void shouldListOwnersTrackers() {
        given(trackerRepository.findByOwnerId(SOME_OWNER_ID)).willReturn(List.of(rduToMiaTrackerBuilder().build()));

        assertThat(trackerService.listTrackers(SOME_OWNER_ID)).hasSize(1);
        assertThat(trackerService.today()).isEqualTo(TODAY);
    }
}
