package com.slb.staking_backend.common.security;

import com.slb.staking_backend.modules.account.entity.Account;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class CustomUserDetails implements UserDetails {

    // 内部包装账户实体
    private final Account account;

    public CustomUserDetails(Account account) {
        this.account = account;
    }

    public Account getAccount() {
        return account;
    }

    /**
     * 调用方地址（0x 小写），即生命周期守卫中的 actor。
     */
    public String getAddress() {
        return account.getAddress();
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        if (StringUtils.hasText(account.getRole())) {
            return List.of(new SimpleGrantedAuthority("ROLE_" + account.getRole()));
        }
        return Collections.emptyList();
    }

    @Override
    public String getPassword() {
        return account.getPasswordHash();
    }

    @Override
    public String getUsername() {
        return account.getAddress();
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return isActive();
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return isActive();
    }

    private boolean isActive() {
        return account.getStatus() != null && account.getStatus() == 1; // 1=正常, 0=禁用
    }
}
