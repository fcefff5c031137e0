package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.digitera.delivery.domain.CreatorCapability;

@Mapper
public interface CreatorCapabilityMapper extends BaseMapper<CreatorCapability> {
}
