package com.postq;

import com.postq.config.PostQProperties;
import com.postq.internal.ClaimMode;
import com.postq.internal.ExecutionReport;
import com.postq.internal.MessageExecutor;
import com.postq.schedule.RecurrenceEvaluator;
import com.postq.schedule.RecurrenceExpression;
import com.postq.schedule.UnsatisfiableScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for applications: creates scheduled messages and runs the manual
 * operations on them.
 */
@Service
public class ScheduledMessageClient {

    private static final Logger log = LoggerFactory.getLogger(ScheduledMessageClient.class);

    private final ScheduledMessageRepository messageRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final RecurrenceEvaluator recurrenceEvaluator;
    private final MessageExecutor messageExecutor;
    private final PostQProperties properties;

    public ScheduledMessageClient(
            ScheduledMessageRepository messageRepository,
            DeliveryRecordRepository deliveryRecordRepository,
            RecurrenceEvaluator recurrenceEvaluator,
            MessageExecutor messageExecutor,
            PostQProperties properties) {
        this.messageRepository = messageRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.recurrenceEvaluator = recurrenceEvaluator;
        this.messageExecutor = messageExecutor;
        this.properties = properties;
    }

    /**
     * Schedule a message to be sent once. A {@code runAt} in the past makes it
     * due on the next poll.
     */
    public UUID scheduleOnce(MessageContent content, Targeting targeting, Instant runAt) {
        validateContent(content);
        List<String> targetIds = normalizeTargets(targeting);
        if (runAt == null) {
            throw new MessageValidationException("runAt must not be null");
        }

        OffsetDateTime runAtUtc = OffsetDateTime.ofInstant(runAt, ZoneOffset.UTC);
        ScheduledMessage message = newMessage(content, targeting, targetIds);
        message.setScheduleType(ScheduleType.ONCE);
        message.setRunAt(runAtUtc);
        message.setNextRunAt(runAtUtc);
        messageRepository.save(message);
        log.debug("Scheduled message {} once at {}", message.getId(), runAtUtc);
        return message.getId();
    }

    /**
     * Schedule a message on a five-field recurrence expression evaluated in
     * {@code zone}, or in {@code postq.defaults.time-zone} when no zone is given.
     */
    public UUID scheduleRecurring(MessageContent content, Targeting targeting, String cron, ZoneId zone,
            Instant endAt) {
        validateContent(content);
        List<String> targetIds = normalizeTargets(targeting);
        if (cron == null || cron.isBlank()) {
            throw new MessageValidationException("Recurrence expression must not be blank");
        }
        RecurrenceExpression expression = RecurrenceExpression.parse(cron);
        ZoneId resolvedZone = zone != null ? zone : defaultZone();

        Instant first;
        try {
            first = recurrenceEvaluator.nextOccurrence(expression, resolvedZone, Instant.now());
        } catch (UnsatisfiableScheduleException e) {
            throw new MessageValidationException("Recurrence expression '" + cron.trim() + "' never fires", e);
        }
        if (endAt != null && first.isAfter(endAt)) {
            throw new MessageValidationException(
                    "endAt " + endAt + " is before the first occurrence " + first + " of '" + cron.trim() + "'");
        }

        ScheduledMessage message = newMessage(content, targeting, targetIds);
        message.setScheduleType(ScheduleType.RECURRING);
        message.setCron(expression.expression());
        message.setTimeZone(resolvedZone.getId());
        message.setEndAt(endAt == null ? null : OffsetDateTime.ofInstant(endAt, ZoneOffset.UTC));
        message.setNextRunAt(OffsetDateTime.ofInstant(first, ZoneOffset.UTC));
        messageRepository.save(message);
        log.debug("Scheduled recurring message {} on '{}' in {}, first run {}", message.getId(),
                message.getCron(), resolvedZone, first);
        return message.getId();
    }

    /**
     * Execute a message now, regardless of its schedule. The execution still
     * waits for no other node to hold the message.
     */
    public CompletableFuture<ExecutionReport> runNow(UUID id) {
        requireExists(id);
        log.debug("Manual run requested for message {}", id);
        return messageExecutor.submit(id, ClaimMode.MANUAL);
    }

    /**
     * Pause or resume a message. The next due time is left as it is.
     */
    public void setEnabled(UUID id, boolean enabled) {
        int updated = messageRepository.updateEnabled(id, enabled, OffsetDateTime.now());
        if (updated == 0) {
            throw new ScheduledMessageNotFoundException(id);
        }
        log.debug("Message {} {}", id, enabled ? "resumed" : "paused");
    }

    /**
     * Copy a message's content and targeting into a new message sent once at
     * {@code runAt} local time in {@code zone}.
     */
    public UUID cloneAsOnce(UUID id, LocalDateTime runAt, ZoneId zone) {
        if (runAt == null) {
            throw new MessageValidationException("runAt must not be null");
        }
        ScheduledMessage source = messageRepository.findById(id)
                .orElseThrow(() -> new ScheduledMessageNotFoundException(id));
        ZoneId resolvedZone = zone != null ? zone : defaultZone();

        MessageContent content = new MessageContent(source.getTitle(), source.getBody(), source.getImageUrls(),
                source.getRenderMode(), source.isDisablePreview());
        Targeting targeting = new Targeting(source.getTargetsMode(), source.getTargetIds());
        UUID cloneId = scheduleOnce(content, targeting, runAt.atZone(resolvedZone).toInstant());
        log.debug("Cloned message {} into once message {}", id, cloneId);
        return cloneId;
    }

    public Optional<ScheduledMessage> find(UUID id) {
        return messageRepository.findById(id);
    }

    public Page<ScheduledMessage> list(Pageable pageable) {
        return messageRepository.findAll(pageable);
    }

    /**
     * Most recent delivery records of a message, newest first.
     */
    public List<DeliveryRecord> deliveries(UUID id, int limit) {
        requireExists(id);
        return deliveryRecordRepository.findByMessageIdOrderByRecordedAtDesc(id, PageRequest.of(0, Math.max(1,
                limit)));
    }

    private ScheduledMessage newMessage(MessageContent content, Targeting targeting, List<String> targetIds) {
        ScheduledMessage message = new ScheduledMessage(UUID.randomUUID(), content.title().strip(), content.body());
        message.setImageUrls(content.imageUrls());
        message.setRenderMode(content.renderMode());
        message.setDisablePreview(content.disablePreview());
        message.setTargetsMode(targeting.mode());
        message.setTargetIds(targetIds);
        message.setStatus(MessageStatus.SCHEDULED);
        message.setEnabled(true);
        return message;
    }

    private void validateContent(MessageContent content) {
        if (content == null) {
            throw new MessageValidationException("Message content must not be null");
        }
        if (content.title() == null || content.title().isBlank()) {
            throw new MessageValidationException("Message title must not be blank");
        }
        for (String imageUrl : content.imageUrls()) {
            if (imageUrl.isBlank()) {
                throw new MessageValidationException("Image URLs must not be blank");
            }
        }
    }

    private List<String> normalizeTargets(Targeting targeting) {
        if (targeting == null) {
            throw new MessageValidationException("Targeting must not be null");
        }
        if (targeting.mode() == TargetsMode.ALL) {
            return List.of();
        }
        List<String> targetIds = new ArrayList<>();
        for (String targetId : targeting.targetIds()) {
            if (!targetId.isBlank() && !targetIds.contains(targetId.trim())) {
                targetIds.add(targetId.trim());
            }
        }
        if (targetIds.isEmpty()) {
            throw new MessageValidationException("Explicit targeting needs at least one target id");
        }
        return targetIds;
    }

    private void requireExists(UUID id) {
        if (!messageRepository.existsById(id)) {
            throw new ScheduledMessageNotFoundException(id);
        }
    }

    private ZoneId defaultZone() {
        try {
            return ZoneId.of(properties.getDefaults().getTimeZone());
        } catch (DateTimeException e) {
            throw new IllegalStateException(
                    "Invalid postq.defaults.time-zone '" + properties.getDefaults().getTimeZone() + "'", e);
        }
    }
}
