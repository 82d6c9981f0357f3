package com.sunny.hubsso.auth.mapper;

import java.util.Collection;
import java.util.List;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.hubsso.auth.entity.UserRole;
import com.sunny.hubsso.auth.model.UserRoleName;

/**
 * 用户角色 Mapper 接口
 *
 * @author sunny
 */
@Mapper
public interface UserRoleMapper extends BaseMapper<UserRole> {

    /**
     * 查询用户的角色名列表，按角色ID排序
     */
    @Select("SELECT r.name FROM roles r "
            + "JOIN user_roles ur ON ur.role_id = r.id "
            + "WHERE ur.user_id = #{userId} ORDER BY r.id")
    List<String> selectRoleNamesByUserId(@Param("userId") Long userId);

    /**
     * 批量查询多个用户的角色名，按用户ID与角色ID排序
     */
    @Select("<script>"
            + "SELECT ur.user_id, r.name AS role_name FROM roles r "
            + "JOIN user_roles ur ON ur.role_id = r.id "
            + "WHERE ur.user_id IN "
            + "<foreach collection='userIds' item='userId' open='(' separator=',' close=')'>#{userId}</foreach> "
            + "ORDER BY ur.user_id, r.id"
            + "</script>")
    List<UserRoleName> selectRoleNamesByUserIds(@Param("userIds") Collection<Long> userIds);
}
