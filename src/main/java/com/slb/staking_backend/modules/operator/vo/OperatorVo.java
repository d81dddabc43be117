package com.slb.staking_backend.modules.operator.vo;

import com.slb.staking_backend.modules.operator.entity.OperatorEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "运营方白名单条目 / Operator allow-list entry")
public class OperatorVo {

    @Schema(description = "运营方地址 / Operator address", example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    private String address;

    @Schema(description = "是否启用 / Enabled", example = "true")
    private Boolean enabled;

    @Schema(description = "最近修改人 / Last updated by", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String updatedBy;

    @Schema(description = "最近修改时间 / Last updated at")
    private LocalDateTime updatedAt;

    public static OperatorVo from(OperatorEntry entry) {
        OperatorVo vo = new OperatorVo();
        vo.setAddress(entry.getAddress());
        vo.setEnabled(entry.getEnabled());
        vo.setUpdatedBy(entry.getUpdatedBy());
        vo.setUpdatedAt(entry.getUpdatedAt());
        return vo;
    }
}
