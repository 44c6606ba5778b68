package com.jz.crm.controller;

import com.jz.crm.common.Result;
import com.jz.crm.domain.dto.OperatorReplyRequest;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.service.OperatorDeskService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("api/conversations")
@RequiredArgsConstructor
public class OperatorController {

    private final OperatorDeskService desk;

    @PostMapping("/{id}/accept")
    public Result<Conversation> accept(@PathVariable Long id, @RequestParam Long operatorId) {
        return Result.success(desk.accept(id, operatorId));
    }

    @PostMapping("/{id}/resolve")
    public Result<Conversation> resolve(@PathVariable Long id) {
        return Result.success(desk.resolve(id));
    }

    @PostMapping("/{id}/close")
    public Result<Conversation> close(@PathVariable Long id) {
        return Result.success(desk.close(id));
    }

    @PostMapping("/{id}/messages")
    public Result<Message> reply(@PathVariable Long id, @RequestBody OperatorReplyRequest req) {
        return Result.success(desk.reply(id, req.getOperatorId(), req.getText()));
    }

    @GetMapping("/queues")
    public Result<Map<String, Long>> queues() {
        return Result.success(desk.queueSizes());
    }
}
