package br.fluitax.common.dto.kardex;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Effective filters of a report (after defaults were applied).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KardexFiltersDto {

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime from;             // null = full history

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS")
    private LocalDateTime to;

    private List<CompanyDto> companies;
}
