package com.firefly.prdagent.mapper;

import com.firefly.prdagent.entity.ChatSession;
import java.util.Optional;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ChatSessionMapper {

    Optional<ChatSession> findById(@Param("id") String id);
}
