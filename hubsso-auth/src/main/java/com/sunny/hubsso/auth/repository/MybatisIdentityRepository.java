package com.sunny.hubsso.auth.repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.sunny.hubsso.auth.entity.User;
import com.sunny.hubsso.auth.mapper.UserMapper;
import com.sunny.hubsso.auth.mapper.UserRoleMapper;
import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.auth.model.IdentityQuery;
import com.sunny.hubsso.auth.model.UserRoleName;

import lombok.RequiredArgsConstructor;

/**
 * 基于 MyBatis-Plus 的身份仓储实现
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Repository
@RequiredArgsConstructor
public class MybatisIdentityRepository implements IdentityRepository {

    private final UserMapper userMapper;
    private final UserRoleMapper userRoleMapper;

    @Override
    public Optional<Identity> findByEmailAndHub(String email, long hubId) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(userMapper.selectByEmailAndHub(email, hubId)).map(this::toIdentity);
    }

    @Override
    public Optional<Identity> findById(long id) {
        return Optional.ofNullable(userMapper.selectById(id)).map(this::toIdentity);
    }

    @Override
    public List<Identity> listByHub(IdentityQuery query) {
        Page<User> page = query.page() == null
                ? new Page<>(1, -1, false)
                : new Page<>(Math.max(query.page(), 1), query.pageSize(), false);
        String role = StringUtils.hasText(query.role()) ? query.role().trim() : null;
        String search = StringUtils.hasText(query.search()) ? escapeLike(query.search().trim()) : null;

        List<User> users = userMapper.selectHubUsersPage(page, query.hubId(), role, search);
        if (users == null || users.isEmpty()) {
            return List.of();
        }

        Map<Long, List<String>> rolesByUser = new LinkedHashMap<>();
        users.forEach(user -> rolesByUser.put(user.getId(), new ArrayList<>()));
        for (UserRoleName row : userRoleMapper.selectRoleNamesByUserIds(rolesByUser.keySet())) {
            List<String> roles = rolesByUser.get(row.getUserId());
            if (roles != null) {
                roles.add(row.getRoleName());
            }
        }
        return users.stream()
                .map(user -> toIdentity(user, rolesByUser.get(user.getId())))
                .toList();
    }

    private Identity toIdentity(User user) {
        return toIdentity(user, userRoleMapper.selectRoleNamesByUserId(user.getId()));
    }

    private Identity toIdentity(User user, List<String> roles) {
        return new Identity(
                user.getId(),
                user.getEmail(),
                user.getHubId(),
                user.getName(),
                user.getPasswordHash(),
                roles);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
