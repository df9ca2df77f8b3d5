package com.flighttracker.tracker.infrastructure.db.tracker;

import com.flighttracker.common.flight.SeatClass;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "trackers")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackerEntity {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Column(nullable = false, length = 3)
    private String origin;

    @Column(nullable = false, length = 3)
    private String destination;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(nullable = false)
    private int adults;

    @Enumerated(EnumType.STRING)
    @Column(name = "seat_class", nullable = false, length = 20)
    private SeatClass seatClass;

    @Column(name = "max_stops")
    private Integer maxStops;

    @Column(name = "threshold_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal thresholdPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_checked_at")
    private Instant lastCheckedAt;

    @Column(name = "last_price", precision = 12, scale = 2)
    private BigDecimal lastPrice;

    @Column(name = "last_price_date")
    private LocalDate lastPriceDate;

    @Column(name = "lowest_price", precision = 12, scale = 2)
    private BigDecimal lowestPrice;

    @Column(name = "lowest_price_date")
    private LocalDate lowestPriceDate;

    @Column(name = "last_notified_price", precision = 12, scale = 2)
    private BigDecimal lastNotifiedPrice;

    @Column(name = "last_notified_price_date")
    private LocalDate lastNotifiedPriceDate;

    @Column(name = "last_notified_at")
    private Instant lastNotifiedAt;

    @Column(name = "poll_cycles", nullable = false)
    private long pollCycles;

    @Column(nullable = false)
    private boolean stale;
}
