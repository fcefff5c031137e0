package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.digitera.delivery.domain.DownloadEvent;

/**
 * 下载审计日志Mapper（只插入、查询）
 */
@Mapper
public interface DownloadEventMapper extends BaseMapper<DownloadEvent> {
}
