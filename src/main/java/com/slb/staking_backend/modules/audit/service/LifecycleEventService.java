package com.slb.staking_backend.modules.audit.service;

import com.slb.staking_backend.modules.audit.entity.LifecycleEvent;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import com.slb.staking_backend.modules.audit.mapper.LifecycleEventMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class LifecycleEventService {

    private final LifecycleEventMapper lifecycleEventMapper;
    private final Clock clock;

    public LifecycleEventService(LifecycleEventMapper lifecycleEventMapper, Clock clock) {
        this.lifecycleEventMapper = lifecycleEventMapper;
        this.clock = clock;
    }

    /**
     * 记录一次状态转移，并输出一行 INFO 日志。需在调用方事务内执行，随转移一同提交或回滚。
     */
    @Transactional
    public void record(LifecycleSubject subject, Long subjectId, String action,
                       Enum<?> from, Enum<?> to, String actor, String detail) {
        LifecycleEvent event = new LifecycleEvent();
        event.setSubjectType(subject);
        event.setSubjectId(subjectId);
        event.setAction(action);
        event.setFromState(from != null ? from.name() : null);
        event.setToState(to != null ? to.name() : null);
        event.setActor(actor);
        event.setDetail(detail);
        event.setEventTime(LocalDateTime.now(clock));
        lifecycleEventMapper.insert(event);
        log.info("{} {} {}: {} -> {} (actor={}{})", subject, subjectId, action,
                event.getFromState(), event.getToState(), actor,
                detail != null ? ", " + detail : "");
    }

    public List<LifecycleEvent> history(LifecycleSubject subject, Long subjectId) {
        return lifecycleEventMapper.findBySubject(subject, subjectId);
    }
}
