package com.slb.staking_backend.modules.custody.vo;

import com.slb.staking_backend.modules.custody.entity.CustodyBalance;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

@Data
@Schema(description = "托管余额汇总 / Custody balance summary (wei, decimal strings)")
public class CustodySummaryVo {

    @Schema(description = "未终结存款占用 / Stake held for open deposit records", example = "32000000000000000000")
    private String pending;

    @Schema(description = "已提交至存款合约且未退出 / Stake backing live validators", example = "64000000000000000000")
    private String committed;

    @Schema(description = "已退出待领取 / Stake returned from exited validators awaiting claim", example = "0")
    private String exited;

    @Schema(description = "当前持有余额 = pending + exited / Balance currently held", example = "32000000000000000000")
    private String held;

    @Schema(description = "最近更新时间 / Last update time")
    private LocalDateTime updatedAt;

    public static CustodySummaryVo from(CustodyBalance balance) {
        CustodySummaryVo vo = new CustodySummaryVo();
        BigInteger pending = balance.getPending() != null ? balance.getPending() : BigInteger.ZERO;
        BigInteger exited = balance.getExited() != null ? balance.getExited() : BigInteger.ZERO;
        vo.setPending(pending.toString());
        vo.setCommitted(balance.getCommitted() != null ? balance.getCommitted().toString() : "0");
        vo.setExited(exited.toString());
        vo.setHeld(pending.add(exited).toString());
        vo.setUpdatedAt(balance.getUpdatedAt());
        return vo;
    }
}
