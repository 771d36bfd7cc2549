package io.github.cyfko.taskfilter.jpa;

import java.time.LocalDate;

/**
 * One row of a filtered task listing.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TaskSummary(Long id, String title, String status, String priority, LocalDate dueDate) {
}
