package com.sunny.hubsso.auth.model;

import lombok.Data;

/**
 * 用户ID与角色名的查询行
 */
@Data
public class UserRoleName {
    private Long userId;
    private String roleName;
}
