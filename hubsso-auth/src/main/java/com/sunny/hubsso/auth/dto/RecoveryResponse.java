package com.sunny.hubsso.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 找回请求结果，不返回Token本身
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RecoveryResponse")
public class RecoveryResponse {

    private boolean delivered;
    private long expiresAt;
}
