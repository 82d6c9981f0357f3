package com.sunny.hubsso.auth.mapper;

import java.util.List;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.hubsso.auth.entity.User;

/**
 * 用户 Mapper 接口
 *
 * @author sunny
 */
@Mapper
public interface UserMapper extends BaseMapper<User> {

    /**
     * 根据邮箱与Hub查询用户
     */
    @Select("SELECT id, email, name, hub_id, password_hash, created_at, updated_at "
            + "FROM users WHERE email = #{email} AND hub_id = #{hubId} LIMIT 1")
    User selectByEmailAndHub(@Param("email") String email, @Param("hubId") Long hubId);

    /**
     * 按Hub分页查询用户，可按角色名与邮箱/姓名关键字过滤，按ID升序
     * search 需已转义 LIKE 通配符
     */
    @Select("<script>"
            + "SELECT u.id, u.email, u.name, u.hub_id, u.password_hash, u.created_at, u.updated_at "
            + "FROM users u WHERE u.hub_id = #{hubId} "
            + "<if test='role != null'>"
            + "AND u.id IN (SELECT ur.user_id FROM user_roles ur "
            + "JOIN roles r ON r.id = ur.role_id WHERE r.name = #{role}) "
            + "</if>"
            + "<if test='search != null'>"
            + "AND (u.name LIKE CONCAT('%', #{search}, '%') OR u.email LIKE CONCAT('%', #{search}, '%')) "
            + "</if>"
            + "ORDER BY u.id ASC"
            + "</script>")
    List<User> selectHubUsersPage(IPage<User> page,
                                  @Param("hubId") Long hubId,
                                  @Param("role") String role,
                                  @Param("search") String search);
}
