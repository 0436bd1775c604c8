package com.slb.proceeds_pool.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 已认证账户：username 即账户地址（已规范化），权限来自 token 中的 role claim。
 */
public class CustomUserDetails implements UserDetails {

    private final String address;
    private final String role;

    public CustomUserDetails(String address, String role) {
        this.address = address;
        this.role = role;
    }

    public String getAddress() {
        return address;
    }

    public String getRole() {
        return role;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        if (StringUtils.hasText(role)) {
            return List.of(new SimpleGrantedAuthority("ROLE_" + role));
        }
        return Collections.emptyList();
    }

    @Override
    public String getPassword() {
        // 无密码登录：身份完全由 token 承载
        return null;
    }

    @Override
    public String getUsername() {
        return address;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
