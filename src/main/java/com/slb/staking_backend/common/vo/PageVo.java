package com.slb.staking_backend.common.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "分页结果 / Paged result")
public class PageVo<T> {

    @Schema(description = "总条数 / Total rows", example = "42")
    private Long total;

    @Schema(description = "页码，从 1 开始 / Page number, 1-based", example = "1")
    private Integer page;

    @Schema(description = "每页数量，最大 100 / Page size, at most 100", example = "10")
    private Integer size;

    @Schema(description = "本页数据 / Rows of this page")
    private List<T> list;
}
