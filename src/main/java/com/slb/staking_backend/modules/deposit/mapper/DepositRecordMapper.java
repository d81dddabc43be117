package com.slb.staking_backend.modules.deposit.mapper;

import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

@Mapper
public interface DepositRecordMapper {

    void insert(DepositRecord record);

    Optional<DepositRecord> findById(@Param("id") Long id);

    /**
     * 行级锁读取（SELECT ... FOR UPDATE），同一记录上的生命周期动作由此串行化。
     */
    Optional<DepositRecord> lockByIdForUpdate(@Param("id") Long id);

    /**
     * 条件更新：仅当当前状态仍为 expectedState 时写入，返回影响行数（0 表示状态已被并发修改）。
     */
    int updateIfState(@Param("record") DepositRecord record, @Param("expectedState") DepositState expectedState);

    /**
     * 取消时删除记录；同样以 expectedState 为条件。
     */
    int deleteIfState(@Param("id") Long id, @Param("expectedState") DepositState expectedState);

    /**
     * 转让记录句柄（仅 FINALIZED）。
     */
    int updateOwnerIfFinalized(@Param("id") Long id,
                               @Param("currentOwner") String currentOwner,
                               @Param("newOwner") String newOwner);

    /**
     * 标记验证者已退出（仅 FINALIZED 且尚未退出）。
     */
    int markExited(@Param("id") Long id, @Param("exitEpoch") Long exitEpoch);

    List<DepositRecord> findByOwnerPaginated(@Param("ownerRef") String ownerRef,
                                             @Param("offset") int offset,
                                             @Param("size") int size);

    long countByOwner(@Param("ownerRef") String ownerRef);

    /**
     * 某句柄持有人名下最早的可退出验证者：FINALIZED、未退出、且未被其他进行中的赎回请求关联。
     */
    Optional<DepositRecord> findOldestExitableByOwner(@Param("ownerRef") String ownerRef);

    /**
     * 未终结记录（REQUESTED/ASSIGNED/CONFIRMED）金额合计，用于托管台账核对。
     */
    BigInteger sumOpenAmount();

    /**
     * FINALIZED 且未退出记录金额合计。
     */
    BigInteger sumCommittedAmount();
}
