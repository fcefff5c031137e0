package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 一次性令牌使用标记
 * 使用 tokenId 主键约束防止同一令牌被重复兑换
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("download_token_marker")
public class DownloadTokenMarker {

    @TableId(value = "token_id", type = IdType.INPUT)
    private String tokenId;

    private String entitlementId;

    private LocalDateTime createTime;
}
