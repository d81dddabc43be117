package com.slb.staking_backend.modules.audit.mapper;

import com.slb.staking_backend.modules.audit.entity.LifecycleEvent;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LifecycleEventMapper {

    int insert(LifecycleEvent event);

    /**
     * 按发生顺序返回某主体的全部事件。
     */
    List<LifecycleEvent> findBySubject(@Param("subjectType") LifecycleSubject subjectType,
                                       @Param("subjectId") Long subjectId);
}
