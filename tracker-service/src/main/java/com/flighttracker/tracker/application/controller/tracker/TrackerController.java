package com.flighttracker.tracker.application.controller.tracker;

import com.flighttracker.tracker.application.controller.tracker.mapper.TrackerRequestResponseMapper;
import com.flighttracker.tracker.domain.tracker.TrackerService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/trackers")
@RequiredArgsConstructor
public class TrackerController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final TrackerService trackerService;
    private final TrackerRequestResponseMapper mapper;

    @PostMapping
    public ResponseEntity<TrackerResponse> createTracker(
            @Valid @RequestBody CreateTrackerRequest request,
            @RequestHeader(OWNER_HEADER) String ownerId) {
        var tracker = trackerService.createTracker(request.toCommand(ownerId));
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(tracker, trackerService.today()));
    }

    @GetMapping
    public List<TrackerResponse> listTrackers(@RequestHeader(OWNER_HEADER) String ownerId) {
        var today = trackerService.today();
        return trackerService.listTrackers(ownerId).stream()
                .map(tracker -> mapper.toResponse(tracker, today))
                .toList();
    }

    @GetMapping("/{trackerId}")
    public TrackerResponse getTracker(@PathVariable String trackerId, @RequestHeader(OWNER_HEADER) String ownerId) {
        return mapper.toResponse(trackerService.getTracker(trackerId, ownerId), trackerService.today());
    }

    @DeleteMapping("/{idOrPrefix}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeTracker(@PathVariable String idOrPrefix, @RequestHeader(OWNER_HEADER) String ownerId) {
        trackerService.removeTracker(ownerId, idOrPrefix);
    }
}
