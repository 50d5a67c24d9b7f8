package se.artisan_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardResponse {
    private long totalActiveArtisans;
    private long regionsCovered;
    private long newRegistrationsThisMonth;
}
