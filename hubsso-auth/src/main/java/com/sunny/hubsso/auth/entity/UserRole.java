package com.sunny.hubsso.auth.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * 用户角色关联实体
 */
@Data
@TableName("user_roles")
public class UserRole {
    @TableField("user_id")
    private Long userId;

    @TableField("role_id")
    private Long roleId;
}
