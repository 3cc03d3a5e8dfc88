package com.firefly.prdagent.mapper;

import com.firefly.prdagent.entity.ChatMessage;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ChatMessageMapper {

    int batchInsert(@Param("messages") List<ChatMessage> messages);

    /**
     * 按 id 整体覆盖可变字段（content/status/token/timestamp），重复执行结果一致。
     * groupSeq 只在原值为空时写入。
     */
    int replace(ChatMessage message);

    /**
     * 按 groupSeq 倒序取最近 limit 条（beforeSeq 为空表示不限）。
     */
    List<ChatMessage> findByGroupDesc(@Param("groupId") String groupId,
                                      @Param("beforeSeq") Long beforeSeq,
                                      @Param("limit") int limit);

    List<ChatMessage> findByGroupAfterSeq(@Param("groupId") String groupId,
                                          @Param("afterSeq") long afterSeq,
                                          @Param("limit") int limit);

    List<ChatMessage> findBySessionDesc(@Param("sessionId") String sessionId,
                                        @Param("limit") int limit);

    Long findMaxGroupSeq(@Param("groupId") String groupId);
}
