package br.fluitax.common.dto.kardex;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Raw-material movement totals for one calendar day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyTotalDto {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    private BigDecimal entriesSacks;
    private BigDecimal exitsSacks;
    private BigDecimal balanceSacks;        // end of day
    private BigDecimal movingAverageCost;   // end of day
}
