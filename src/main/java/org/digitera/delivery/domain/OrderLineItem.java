package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 订单行
 * - 随订单一次性写入，之后不可变
 * - (orderId, lineNo) 唯一
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("order_line_item")
public class OrderLineItem {

    private Long id;

    private String orderId;

    /**
     * 行号，从1开始
     */
    private Integer lineNo;

    private String productId;

    /**
     * 下单时的商品名称快照
     */
    private String productName;

    /**
     * 下单时的单价快照
     */
    private BigDecimal unitPrice;

    private String currency;

    private LocalDateTime createTime;
}
