package com.slb.staking_backend.modules.custody.vo;

import com.slb.staking_backend.modules.custody.entity.CustodyJournal;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "托管流水条目 / Custody journal entry")
public class CustodyJournalVo {

    @Schema(description = "流水 ID / Journal id", example = "1")
    private Long id;

    @Schema(description = "变动类型 / Movement type", example = "reserve",
            allowableValues = {"reserve", "release", "refund", "exit", "payout"})
    private String refType;

    @Schema(description = "关联记录 ID / Referenced deposit or vault request id", example = "42")
    private Long refId;

    @Schema(description = "变动金额 (wei) / Amount moved", example = "32000000000000000000")
    private String amount;

    @Schema(description = "变动后 pending / Pending after")
    private String pendingAfter;

    @Schema(description = "变动后 committed / Committed after")
    private String committedAfter;

    @Schema(description = "变动后 exited / Exited after")
    private String exitedAfter;

    @Schema(description = "发生时间 / Event time")
    private LocalDateTime eventTime;

    public static CustodyJournalVo from(CustodyJournal journal) {
        CustodyJournalVo vo = new CustodyJournalVo();
        vo.setId(journal.getId());
        vo.setRefType(journal.getRefType());
        vo.setRefId(journal.getRefId());
        vo.setAmount(String.valueOf(journal.getAmount()));
        vo.setPendingAfter(String.valueOf(journal.getPendingAfter()));
        vo.setCommittedAfter(String.valueOf(journal.getCommittedAfter()));
        vo.setExitedAfter(String.valueOf(journal.getExitedAfter()));
        vo.setEventTime(journal.getEventTime());
        return vo;
    }
}
