package com.firefly.prdagent.mapper;

import com.firefly.prdagent.entity.GroupCompressionState;
import java.util.Optional;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface GroupCompressionStateMapper {

    Optional<GroupCompressionState> findByGroupId(@Param("groupId") String groupId);

    /**
     * 仅当新检查点的 toSeq 大于已存值时覆盖；返回 0 表示被更新的检查点拒绝。
     */
    int upsertIfNewer(GroupCompressionState state);
}
