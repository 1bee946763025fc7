package com.reviewtrack.api.dto;

/**
 * Items reaching each stage within one month (yyyy-MM, UTC).
 */
public record MonthlyProgressResponse(String month, long annotated, long validated, long published, long publishFailed) {
}
