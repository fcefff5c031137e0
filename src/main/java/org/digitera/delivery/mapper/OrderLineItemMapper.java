package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.digitera.delivery.domain.OrderLineItem;

import java.util.List;

@Mapper
public interface OrderLineItemMapper extends BaseMapper<OrderLineItem> {

    @Select("SELECT * FROM order_line_item WHERE order_id = #{orderId} ORDER BY line_no")
    List<OrderLineItem> selectByOrderId(@Param("orderId") String orderId);
}
