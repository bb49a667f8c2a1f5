package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.domain.model.BookingChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Booking change feed reading the booking domain's {@code bookings} and
 * {@code properties} tables directly. Hosts are the users owning the properties.
 */
@Component
public class JdbcBookingChangeFeed implements BookingChangeFeed {

    private static final Logger logger = LoggerFactory.getLogger(JdbcBookingChangeFeed.class);

    static final String CHANGED_BOOKINGS_SQL =
            "SELECT b.id AS booking_id, b.status, b.property_id, p.title AS property_title, b.guest_name, " +
            "b.check_in, b.check_out, b.total_amount, b.updated_at, b.created_at " +
            "FROM bookings b JOIN properties p ON p.id = b.property_id " +
            "WHERE p.user_id = :hostId AND b.updated_at >= :since " +
            "ORDER BY b.updated_at DESC " +
            "LIMIT :limit";

    private static final RowMapper<BookingChange> ROW_MAPPER = (rs, rowNum) -> BookingChange.builder()
            .bookingId(rs.getString("booking_id"))
            .status(rs.getString("status"))
            .propertyId(rs.getString("property_id"))
            .propertyTitle(rs.getString("property_title"))
            .guestName(rs.getString("guest_name"))
            .checkIn(toLocalDate(rs.getDate("check_in")))
            .checkOut(toLocalDate(rs.getDate("check_out")))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
            .createdAt(toLocalDateTime(rs.getTimestamp("created_at")))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcBookingChangeFeed(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<BookingChange> changedSince(String hostId, LocalDateTime since, int limit) {
        UUID ownerId;
        try {
            ownerId = UUID.fromString(hostId);
        } catch (IllegalArgumentException e) {
            logger.debug("Host id {} is not a user id, no bookings to poll", hostId);
            return Collections.emptyList();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("hostId", ownerId)
                .addValue("since", Timestamp.valueOf(since))
                .addValue("limit", limit);

        return jdbcTemplate.query(CHANGED_BOOKINGS_SQL, params, ROW_MAPPER);
    }

    private static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toLocalDateTime();
    }
}
