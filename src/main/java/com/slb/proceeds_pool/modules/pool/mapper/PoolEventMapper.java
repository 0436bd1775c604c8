package com.slb.proceeds_pool.modules.pool.mapper;

import com.slb.proceeds_pool.modules.pool.entity.PoolEvent;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface PoolEventMapper {

    int insert(PoolEvent event);

    long countByPool(@Param("poolId") Long poolId, @Param("eventType") String eventType);

    List<PoolEvent> selectByPool(@Param("poolId") Long poolId,
                                 @Param("eventType") String eventType,
                                 @Param("offset") int offset,
                                 @Param("size") int size);
}
