package com.slb.staking_backend.modules.custody.controller;

import com.slb.staking_backend.common.api.ApiResponse;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.modules.custody.service.CustodyLedgerService;
import com.slb.staking_backend.modules.custody.vo.CustodyJournalVo;
import com.slb.staking_backend.modules.custody.vo.CustodySummaryVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/custody")
@Tag(name = "托管台账", description = "合约托管资金三分量（pending / committed / exited）与流水")
public class CustodyController {

    private final CustodyLedgerService custodyLedgerService;

    public CustodyController(CustodyLedgerService custodyLedgerService) {
        this.custodyLedgerService = custodyLedgerService;
    }

    @GetMapping("/summary")
    @Operation(summary = "托管余额汇总", description = "held = pending + exited；committed 已转入存款合约，不计入持有。")
    public ApiResponse<CustodySummaryVo> summary() {
        return ApiResponse.ok(custodyLedgerService.summary());
    }

    @GetMapping("/journal")
    @Operation(summary = "托管流水", description = "按时间倒序分页返回每次变动及变动后的三分量。")
    public ApiResponse<PageVo<CustodyJournalVo>> journal(@Parameter(description = "页码，从 1 开始", example = "1")
                                                         @RequestParam(defaultValue = "1") int page,
                                                         @Parameter(description = "每页数量", example = "20")
                                                         @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(custodyLedgerService.journal(page, size));
    }
}
