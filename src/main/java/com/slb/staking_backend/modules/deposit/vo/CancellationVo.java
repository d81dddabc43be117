package com.slb.staking_backend.modules.deposit.vo;

import com.slb.staking_backend.modules.deposit.enums.DepositState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "取消可用性 / Cancellation availability")
public class CancellationVo {

    @Schema(description = "记录 ID / Record id", example = "42")
    private Long id;

    @Schema(description = "当前状态 / Current state", example = "CONFIRMED")
    private DepositState state;

    @Schema(description = "当前是否可取消 / Cancellable right now", example = "false")
    private boolean cancellable;

    @Schema(description = "最早可取消时间；永不可取消时为空 / Earliest cancellation time, null when never")
    private LocalDateTime availableAt;
}
