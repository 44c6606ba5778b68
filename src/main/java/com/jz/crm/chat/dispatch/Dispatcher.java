package com.jz.crm.chat.dispatch;

import com.jz.crm.channel.ChannelAddresses;
import com.jz.crm.channel.MessageSender;
import com.jz.crm.chat.async.DebounceGate;
import com.jz.crm.chat.queue.HandoffOutcome;
import com.jz.crm.chat.queue.SectorQueueRouter;
import com.jz.crm.chat.state.BusinessHoursEvaluator;
import com.jz.crm.chat.state.ConversationStateMachine;
import com.jz.crm.classifier.ClassifierVerdict;
import com.jz.crm.classifier.IntentClassifier;
import com.jz.crm.config.RoutingProperties;
import com.jz.crm.domain.dto.InboundMessage;
import com.jz.crm.domain.dto.SendResult;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.domain.entity.Customer;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.domain.entity.MessageKind;
import com.jz.crm.domain.entity.SenderRole;
import com.jz.crm.guard.DedupGuard;
import com.jz.crm.memory.ContextStore;
import com.jz.crm.memory.ContextTurn;
import com.jz.crm.notify.OperatorNotifier;
import com.jz.crm.service.ConversationService;
import com.jz.crm.service.CustomerService;
import com.jz.crm.service.MessageService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One unit of work per inbound customer message.
 * <pre>
 * customer -> conversation -> persist inbound -> context(user) -> debounce
 *   -> [superseded? stop] -> [operator engaged? stop] -> classify -> [duplicate reply? stop]
 *   -> tag intent -> send -> persist reply -> context(assistant) -> route -> notify
 * </pre>
 * Everything up to the inbound persist runs on the caller's thread and may throw.
 * After that nothing escapes: failures are logged and end the run as {@link DispatchOutcome#FAILED}.
 * The debounce wait parks on {@code debounceScheduler}; the rest runs on {@code dispatchExecutor}.
 */
@Slf4j
@Component
public class Dispatcher {

    static final String BOT_SENDER_ID = "bot";

    private final CustomerService customerService;
    private final ConversationService conversationService;
    private final MessageService messageService;
    private final ConversationStateMachine stateMachine;
    private final ContextStore contextStore;
    private final DebounceGate debounceGate;
    private final IntentClassifier classifier;
    private final DedupGuard dedupGuard;
    private final SectorQueueRouter router;
    private final MessageSender sender;
    private final OperatorNotifier notifier;
    private final BusinessHoursEvaluator businessHours;
    private final RoutingProperties routing;
    private final Clock clock;
    private final Executor dispatchExecutor;
    private final ScheduledExecutorService debounceScheduler;

    private final Map<DispatchOutcome, Counter> outcomeCounters = new EnumMap<>(DispatchOutcome.class);
    private final Timer classifyTimer;

    public Dispatcher(CustomerService customerService,
                      ConversationService conversationService,
                      MessageService messageService,
                      ConversationStateMachine stateMachine,
                      ContextStore contextStore,
                      DebounceGate debounceGate,
                      IntentClassifier classifier,
                      DedupGuard dedupGuard,
                      SectorQueueRouter router,
                      MessageSender sender,
                      OperatorNotifier notifier,
                      BusinessHoursEvaluator businessHours,
                      RoutingProperties routing,
                      Clock clock,
                      @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                      @Qualifier("debounceScheduler") ScheduledExecutorService debounceScheduler,
                      MeterRegistry registry) {
        this.customerService = customerService;
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.stateMachine = stateMachine;
        this.contextStore = contextStore;
        this.debounceGate = debounceGate;
        this.classifier = classifier;
        this.dedupGuard = dedupGuard;
        this.router = router;
        this.sender = sender;
        this.notifier = notifier;
        this.businessHours = businessHours;
        this.routing = routing;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.debounceScheduler = debounceScheduler;

        for (DispatchOutcome o : DispatchOutcome.values()) {
            outcomeCounters.put(o, Counter.builder("crm.dispatch.outcome")
                    .description("Inbound messages by how their unit of work ended")
                    .tag("outcome", o.tag())
                    .register(registry));
        }
        this.classifyTimer = Timer.builder("crm.classifier.latency")
                .description("Classifier round trip")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);
    }

    /** Webhook entry point: runs the whole unit of work on the dispatch pool and returns at once. */
    public void submit(InboundMessage in) {
        dispatchExecutor.execute(() -> {
            try {
                dispatch(in);
            } catch (Exception e) {
                log.error("[Dispatch] inbound rejected, from={}, err={}", in.getFrom(), e.getMessage(), e);
                outcomeCounters.get(DispatchOutcome.FAILED).increment();
            }
        });
    }

    public CompletableFuture<DispatchOutcome> dispatch(InboundMessage in) {
        String address = ChannelAddresses.normalize(in.getFrom());
        if (!StringUtils.hasText(address) || !StringUtils.hasText(in.getText())) {
            throw new IllegalArgumentException("inbound message needs a sender and a text");
        }

        Customer customer = resolveCustomer(address, in.getSenderName());
        Conversation conversation = stateMachine.resolveActive(customer);
        Message inbound = persistInbound(conversation, address, in);
        log.info("[Dispatch] inbound persisted, conv={}, msg={}, from={}", conversation.getId(), inbound.getId(), address);

        CompletableFuture<DispatchOutcome> result = new CompletableFuture<>();
        try {
            contextStore.append(address, ContextTurn.USER, in.getText());
            long armedAt = debounceGate.arm(address);
            debounceScheduler.schedule(() -> {
                try {
                    dispatchExecutor.execute(() ->
                            result.complete(afterDebounce(address, armedAt, customer, conversation.getId(), inbound)));
                } catch (RejectedExecutionException e) {
                    log.error("[Dispatch] pool saturated, conv={}", conversation.getId());
                    result.complete(count(DispatchOutcome.FAILED));
                }
            }, debounceGate.delay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.error("[Dispatch] scheduling failed, conv={}, err={}", conversation.getId(), e.getMessage(), e);
            result.complete(count(DispatchOutcome.FAILED));
        }
        return result;
    }

    private DispatchOutcome afterDebounce(String address, long armedAt, Customer customer, Long conversationId, Message inbound) {
        try {
            if (debounceGate.supersededSince(address, armedAt)) {
                log.debug("[Dispatch] superseded, conv={}, msg={}", conversationId, inbound.getId());
                return count(DispatchOutcome.SUPERSEDED);
            }

            Conversation conversation = conversationService.findById(conversationId);
            if (conversation == null) {
                log.error("[Dispatch] conversation vanished, conv={}", conversationId);
                return count(DispatchOutcome.FAILED);
            }
            if (conversation.getStatus() == ConversationStatus.IN_PROGRESS) {
                log.info("[Dispatch] operator engaged, bot silent, conv={}", conversationId);
                return count(DispatchOutcome.OPERATOR_ENGAGED);
            }

            List<ContextTurn> turns = contextStore.read(address);
            List<ContextTurn> history = turns.size() > 1 ? turns.subList(0, turns.size() - 1) : List.of();
            ClassifierVerdict verdict = classifyTimer.record(() -> classifier.classify(
                    inbound.getContent(), history, customer.getName(), businessHours.isOpenNow()));
            String reply = verdict.getResponse();
            log.info("[Dispatch] classified, conv={}, intent={}, needsHuman={}, conf={}",
                    conversationId, verdict.getIntent(), verdict.isNeedsHuman(), verdict.getConfidence());

            if (dedupGuard.isDuplicate(address, dedupGuard.keyFor(reply))) {
                log.info("[Dispatch] duplicate reply suppressed, conv={}", conversationId);
                return count(DispatchOutcome.DUPLICATE_SUPPRESSED);
            }

            messageService.tagIntent(inbound.getId(), verdict.getIntent());
            inbound.setIntent(verdict.getIntent());
            Optional<String> sector = router.resolveSector(verdict.getIntent());

            // an operator may have taken over while the classifier ran
            conversation = conversationService.findById(conversationId);
            if (conversation == null) {
                log.error("[Dispatch] conversation vanished, conv={}", conversationId);
                return count(DispatchOutcome.FAILED);
            }
            if (conversation.getStatus() == ConversationStatus.IN_PROGRESS) {
                log.info("[Dispatch] operator engaged during classification, bot silent, conv={}", conversationId);
                return count(DispatchOutcome.OPERATOR_ENGAGED);
            }
            ConversationStatus seen = conversation.getStatus();
            conversation.setIntent(verdict.getIntent());

            SendResult sent = send(address, reply, conversationId);

            Message outbound = Message.builder()
                    .conversationId(conversationId)
                    .senderRole(SenderRole.BOT)
                    .senderId(BOT_SENDER_ID)
                    .content(reply)
                    .kind(MessageKind.TEXT)
                    .channelMessageId(sent.messageSid())
                    .intent(verdict.getIntent())
                    .build();
            messageService.create(outbound);
            contextStore.append(address, ContextTurn.ASSISTANT, reply);

            HandoffOutcome handoff = null;
            if (verdict.isNeedsHuman()) {
                handoff = router.handoff(conversation, sector.orElse(null));
            } else if (sector.isPresent()) {
                conversation.setSector(sector.get());
            }
            if (!conversationService.applyRouting(conversation, seen)) {
                log.warn("[Dispatch] conversation left {} before routing was saved, conv={}, handoff={}",
                        seen.getCode(), conversationId, handoff);
                if (handoff == HandoffOutcome.ENQUEUED || handoff == HandoffOutcome.MIGRATED) {
                    withdrawQueueEntry(conversationId, conversation.getSector());
                }
                handoff = null;
            }

            String notifySector = StringUtils.hasText(conversation.getSector())
                    ? conversation.getSector()
                    : routing.getNotifyFallbackSector();
            notifier.notifyMessage(conversationId, notifySector, inbound);
            notifier.notifyMessage(conversationId, notifySector, outbound);
            if (handoff == HandoffOutcome.ENQUEUED || handoff == HandoffOutcome.MIGRATED) {
                notifier.notifyQueueSizes(router.sizes());
            }
            if (handoff == HandoffOutcome.ENQUEUED) {
                notifier.notifyNewConversation(conversation.getSector(), conversation);
            }
            return count(DispatchOutcome.REPLIED);
        } catch (Exception e) {
            log.error("[Dispatch] unit of work failed, conv={}, msg={}, err={}", conversationId, inbound.getId(), e.getMessage(), e);
            return count(DispatchOutcome.FAILED);
        }
    }

    private void withdrawQueueEntry(Long conversationId, String sector) {
        try {
            Conversation fresh = conversationService.findById(conversationId);
            if (fresh == null || fresh.getStatus() != ConversationStatus.WAITING_QUEUE) {
                router.removeEverywhere(conversationId);
            } else if (!sector.equals(fresh.getSector())) {
                router.remove(sector, conversationId);
            }
        } catch (Exception e) {
            log.error("[Dispatch] queue withdrawal failed, conv={}, sector={}, err={}", conversationId, sector, e.getMessage(), e);
        }
    }

    private SendResult send(String address, String reply, Long conversationId) {
        try {
            SendResult r = sender.send(address, reply);
            if (r == null) return SendResult.failed("no result");
            if (!r.success()) {
                log.error("[Dispatch] send failed, conv={}, err={}", conversationId, r.error());
            }
            return r;
        } catch (Exception e) {
            log.error("[Dispatch] send threw, conv={}, err={}", conversationId, e.getMessage(), e);
            return SendResult.failed(e.getMessage());
        }
    }

    private Customer resolveCustomer(String address, String senderName) {
        LocalDateTime now = LocalDateTime.now(clock);
        Customer c = customerService.findByAddress(address);
        if (c == null) {
            c = Customer.builder()
                    .address(address)
                    .name(StringUtils.hasText(senderName) ? senderName : null)
                    .firstContact(now)
                    .lastContact(now)
                    .build();
            try {
                customerService.create(c);
                log.info("[Dispatch] new customer, id={}, address={}", c.getId(), address);
                return c;
            } catch (DuplicateKeyException e) {
                // a message of the same burst inserted the address first
                c = customerService.findByAddress(address);
                if (c == null) throw e;
                log.info("[Dispatch] customer created concurrently, id={}, address={}", c.getId(), address);
            }
        }
        c.setLastContact(now);
        if (!StringUtils.hasText(c.getName()) && StringUtils.hasText(senderName)) {
            c.setName(senderName);
        }
        customerService.modify(c);
        return c;
    }

    private Message persistInbound(Conversation conversation, String address, InboundMessage in) {
        Message m = Message.builder()
                .conversationId(conversation.getId())
                .senderRole(SenderRole.CUSTOMER)
                .senderId(address)
                .content(in.getText())
                .kind(in.getKind() == null ? MessageKind.TEXT : in.getKind())
                .mediaUrl(in.getMediaUrl())
                .channelMessageId(in.getChannelMessageId())
                .build();
        messageService.create(m);
        return m;
    }

    private DispatchOutcome count(DispatchOutcome outcome) {
        outcomeCounters.get(outcome).increment();
        return outcome;
    }
}
