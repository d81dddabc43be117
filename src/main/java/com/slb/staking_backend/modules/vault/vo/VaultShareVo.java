package com.slb.staking_backend.modules.vault.vo;

import com.slb.staking_backend.modules.vault.entity.VaultShareBalance;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "金库份额余额 / Vault share balance")
public class VaultShareVo {

    @Schema(description = "持有人 / Owner", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String ownerAddress;

    @Schema(description = "可用份额 / Available shares", example = "32000000000000000000")
    private String available;

    @Schema(description = "赎回锁定份额 / Shares locked by open redemptions", example = "0")
    private String locked;

    public static VaultShareVo from(VaultShareBalance balance) {
        VaultShareVo vo = new VaultShareVo();
        vo.setOwnerAddress(balance.getOwnerAddress());
        vo.setAvailable(String.valueOf(balance.getAvailable()));
        vo.setLocked(String.valueOf(balance.getLocked()));
        return vo;
    }

    public static VaultShareVo empty(String owner) {
        VaultShareVo vo = new VaultShareVo();
        vo.setOwnerAddress(owner);
        vo.setAvailable("0");
        vo.setLocked("0");
        return vo;
    }
}
