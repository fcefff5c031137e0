package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.digitera.delivery.domain.OrderStatusHistory;

@Mapper
public interface OrderStatusHistoryMapper extends BaseMapper<OrderStatusHistory> {
}
