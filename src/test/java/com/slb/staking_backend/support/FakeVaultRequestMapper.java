package com.slb.staking_backend.support;

import com.slb.staking_backend.modules.vault.entity.VaultRequest;
import com.slb.staking_backend.modules.vault.enums.VaultRequestKind;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import com.slb.staking_backend.modules.vault.mapper.VaultRequestMapper;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class FakeVaultRequestMapper extends InMemoryTable<Long, VaultRequest> implements VaultRequestMapper {

    private final AtomicLong ids = new AtomicLong(100);

    public FakeVaultRequestMapper() {
        super(VaultRequest::new);
    }

    @Override
    public void insert(VaultRequest request) {
        request.setId(ids.incrementAndGet());
        write(request.getId(), request);
    }

    @Override
    public Optional<VaultRequest> findById(Long id) {
        return read(id);
    }

    @Override
    public Optional<VaultRequest> lockByIdForUpdate(Long id) {
        return read(id);
    }

    @Override
    public int updateIfState(VaultRequest request, VaultRequestState expectedState) {
        VaultRequest stored = rows.get(request.getId());
        if (stored == null || stored.getState() != expectedState) {
            return 0;
        }
        write(request.getId(), request);
        return 1;
    }

    @Override
    public long countOpenRedeemByValidator(Long validatorId) {
        return select(r -> r.getKind() == VaultRequestKind.REDEEM
                && validatorId.equals(r.getLinkedValidatorId())
                && (r.getState() == VaultRequestState.PENDING || r.getState() == VaultRequestState.PROCESSING)).size();
    }

    @Override
    public long countPendingDepositByValidator(Long validatorId) {
        return select(r -> r.getKind() == VaultRequestKind.DEPOSIT
                && validatorId.equals(r.getLinkedValidatorId())
                && r.getState() == VaultRequestState.PENDING).size();
    }

    @Override
    public List<VaultRequest> findByOwnerPaginated(String ownerRef, int offset, int size) {
        return select(r -> r.getOwnerRef().equals(ownerRef)).stream()
                .sorted(Comparator.comparing(VaultRequest::getId).reversed())
                .skip(offset)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public long countByOwner(String ownerRef) {
        return select(r -> r.getOwnerRef().equals(ownerRef)).size();
    }

    @Override
    public BigInteger sumClaimableRedeemAmount() {
        return select(r -> r.getKind() == VaultRequestKind.REDEEM && r.getState() == VaultRequestState.CLAIMABLE)
                .stream()
                .map(VaultRequest::getAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public List<VaultRequest> all() {
        return select(r -> true);
    }
}
