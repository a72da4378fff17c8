package com.company.tokenanalytics.dto.response;

import com.company.tokenanalytics.domain.enums.Normalization;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenStatsResult {
    private List<Map<String, Object>> rows;
    private Set<Normalization> normalizations;
}
