package com.slb.staking_backend.modules.vault.mapper;

import com.slb.staking_backend.modules.vault.entity.VaultRequest;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

@Mapper
public interface VaultRequestMapper {

    void insert(VaultRequest request);

    Optional<VaultRequest> findById(@Param("id") Long id);

    Optional<VaultRequest> lockByIdForUpdate(@Param("id") Long id);

    /**
     * 条件更新：仅当当前状态仍为 expectedState 时写入。
     */
    int updateIfState(@Param("request") VaultRequest request, @Param("expectedState") VaultRequestState expectedState);

    /**
     * 关联到该验证者、且尚未终结（PENDING/PROCESSING）的赎回请求数。
     */
    long countOpenRedeemByValidator(@Param("validatorId") Long validatorId);

    /**
     * 关联到该存款记录、仍为 PENDING 的金库申购请求数；此时记录只能经由金库推进或取消。
     */
    long countPendingDepositByValidator(@Param("validatorId") Long validatorId);

    List<VaultRequest> findByOwnerPaginated(@Param("ownerRef") String ownerRef,
                                            @Param("offset") int offset,
                                            @Param("size") int size);

    long countByOwner(@Param("ownerRef") String ownerRef);

    /**
     * CLAIMABLE 赎回请求金额合计，用于托管台账核对。
     */
    BigInteger sumClaimableRedeemAmount();
}
