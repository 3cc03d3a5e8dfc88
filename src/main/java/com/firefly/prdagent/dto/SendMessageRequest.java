package com.firefly.prdagent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotBlank(message = "消息内容不能为空")
    @Size(max = 20000, message = "消息内容过长")
    private String content;

    /**
     * 回答视角：PM / DEV / QA，缺省按产品经理视角
     */
    private String answerAsRole;

    private String replyToMessageId;
}
