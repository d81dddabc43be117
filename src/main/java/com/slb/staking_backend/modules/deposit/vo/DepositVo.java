package com.slb.staking_backend.modules.deposit.vo;

import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "存款记录 / Deposit record")
public class DepositVo {

    @Schema(description = "记录 ID / Record id", example = "42")
    private Long id;

    @Schema(description = "生命周期状态 / Lifecycle state", example = "REQUESTED")
    private DepositState state;

    @Schema(description = "句柄持有人 / Handle owner", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String ownerRef;

    @Schema(description = "付款方（退款接收人）/ Depositor, refund recipient")
    private String depositorRef;

    @Schema(description = "提款地址 / Withdrawal address")
    private String withdrawalAddress;

    @Schema(description = "提款凭证（32 字节）/ Withdrawal credentials")
    private String withdrawalCredentials;

    @Schema(description = "验证者公钥 / Validator pubkey")
    private String pubkey;

    @Schema(description = "BLS 签名 / Signature")
    private String signature;

    @Schema(description = "已确认的 deposit_data_root / Committed deposit data root")
    private String committedRoot;

    @Schema(description = "质押金额 (wei) / Stake amount in wei", example = "32000000000000000000")
    private String amount;

    @Schema(description = "分配密钥的运营方 / Assigning operator")
    private String assignedOperator;

    private LocalDateTime createdAt;
    private LocalDateTime assignedAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime finalizedAt;

    @Schema(description = "验证者退出 epoch（未退出为空）/ Exit epoch, null while live")
    private Long exitEpoch;

    public static DepositVo from(DepositRecord record) {
        DepositVo vo = new DepositVo();
        vo.setId(record.getId());
        vo.setState(record.getState());
        vo.setOwnerRef(record.getOwnerRef());
        vo.setDepositorRef(record.getDepositorRef());
        vo.setWithdrawalAddress(record.getWithdrawalAddress());
        vo.setWithdrawalCredentials(record.getWithdrawalCredentials());
        vo.setPubkey(record.getPubkey());
        vo.setSignature(record.getSignature());
        vo.setCommittedRoot(record.getCommittedRoot());
        vo.setAmount(record.getAmount() != null ? record.getAmount().toString() : null);
        vo.setAssignedOperator(record.getAssignedOperator());
        vo.setCreatedAt(record.getCreatedAt());
        vo.setAssignedAt(record.getAssignedAt());
        vo.setConfirmedAt(record.getConfirmedAt());
        vo.setFinalizedAt(record.getFinalizedAt());
        vo.setExitEpoch(record.getExitEpoch());
        return vo;
    }
}
