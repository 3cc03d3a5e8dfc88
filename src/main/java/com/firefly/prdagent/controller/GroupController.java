package com.firefly.prdagent.controller;

import com.firefly.prdagent.compression.GroupCompressionStateService;
import com.firefly.prdagent.service.ChatMessageService;
import com.firefly.prdagent.service.GroupBroadcastService;
import com.firefly.prdagent.vo.ApiResponse;
import com.firefly.prdagent.vo.ChatMessageVO;
import com.firefly.prdagent.vo.CompressionStateVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/groups")
@RequiredArgsConstructor
@Slf4j
public class GroupController {

    private final ChatMessageService chatMessageService;
    private final GroupBroadcastService groupBroadcastService;
    private final GroupCompressionStateService compressionStateService;

    @GetMapping("/{groupId}/messages")
    public ResponseEntity<ApiResponse<Map<String, Object>>> listMessages(@PathVariable String groupId,
                                                                         @RequestParam(defaultValue = "0") long afterSeq,
                                                                         @RequestParam(defaultValue = "100") int limit) {
        List<ChatMessageVO> messages = chatMessageService.listGroupMessages(groupId, afterSeq, limit).stream()
                .map(ChatMessageVO::from)
                .collect(Collectors.toList());
        Long lastSeq = messages.isEmpty() ? afterSeq : messages.get(messages.size() - 1).getGroupSeq();
        Map<String, Object> data = Map.of(
                "messages", messages,
                "lastSeq", lastSeq
        );
        return ResponseEntity.ok(ApiResponse.success("获取群消息成功", data));
    }

    @GetMapping(value = "/{groupId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@PathVariable String groupId,
                                             @RequestHeader(ChatController.USER_HEADER) String userId,
                                             @RequestParam(defaultValue = "0") long afterSeq) {
        SseEmitter emitter = groupBroadcastService.subscribe(groupId, userId, afterSeq);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    @GetMapping("/{groupId}/compression")
    public ResponseEntity<ApiResponse<CompressionStateVO>> compression(@PathVariable String groupId) {
        return compressionStateService.findLive(groupId)
                .map(state -> ResponseEntity.ok(ApiResponse.success(CompressionStateVO.from(state))))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success("暂无压缩检查点", null)));
    }
}
