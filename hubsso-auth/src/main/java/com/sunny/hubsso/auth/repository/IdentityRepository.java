package com.sunny.hubsso.auth.repository;

import java.util.List;
import java.util.Optional;

import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.auth.model.IdentityQuery;

/**
 * 身份只读仓储
 *
 * @author Sunny
 * @date 2026-10-17
 */
public interface IdentityRepository {

    /**
     * 按邮箱与Hub查找身份，邮箱需已规范为小写
     */
    Optional<Identity> findByEmailAndHub(String email, long hubId);

    Optional<Identity> findById(long id);

    /**
     * 列出Hub内身份，按ID升序
     */
    List<Identity> listByHub(IdentityQuery query);
}
