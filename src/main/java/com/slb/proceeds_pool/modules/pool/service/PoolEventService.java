package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.common.trace.TraceIdHolder;
import com.slb.proceeds_pool.common.vo.PageVo;
import com.slb.proceeds_pool.modules.pool.entity.PoolEvent;
import com.slb.proceeds_pool.modules.pool.event.PoolActivityEvent;
import com.slb.proceeds_pool.modules.pool.event.PoolEventType;
import com.slb.proceeds_pool.modules.pool.mapper.PoolEventMapper;
import com.slb.proceeds_pool.modules.pool.vo.PoolEventVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 池子事件审计：监听 PoolActivityEvent 并落库，随业务事务一起提交或回滚。
 */
@Service
@Slf4j
public class PoolEventService {

    private final PoolEventMapper poolEventMapper;

    public PoolEventService(PoolEventMapper poolEventMapper) {
        this.poolEventMapper = poolEventMapper;
    }

    @EventListener
    public void onPoolActivity(PoolActivityEvent event) {
        log.info("Pool event: pool={}, type={}, account={}, counterparty={}, amount={}, accRewardPerShare={}",
                event.poolId(), event.type(), event.account(), event.counterparty(),
                event.amount(), event.cumulativeRewardPerShare());
        PoolEvent row = new PoolEvent();
        row.setPoolId(event.poolId());
        row.setEventType(event.type().name());
        row.setAccount(event.account());
        row.setCounterparty(event.counterparty());
        row.setAmount(event.amount());
        row.setCumulativeRewardPerShare(event.cumulativeRewardPerShare());
        row.setTraceId(TraceIdHolder.getOptional().orElse(null));
        row.setCreatedTime(LocalDateTime.now());
        poolEventMapper.insert(row);
    }

    public PageVo<PoolEventVo> listEvents(Long poolId, PoolEventType type, int page, int size) {
        String eventType = type != null ? type.name() : null;
        long total = poolEventMapper.countByPool(poolId, eventType);
        if (total <= 0) {
            return new PageVo<>(0L, page, size, List.of());
        }
        long offset = Math.max(0L, (long) (page - 1) * size);
        if (offset >= total) {
            return new PageVo<>(total, page, size, List.of());
        }
        List<PoolEventVo> list = poolEventMapper.selectByPool(poolId, eventType, (int) offset, size).stream()
                .map(PoolEventVo::from)
                .toList();
        return new PageVo<>(total, page, size, list);
    }
}
