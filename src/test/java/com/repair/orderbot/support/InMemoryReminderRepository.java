package com.repair.orderbot.support;

import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.enums.ReminderStatus;
import com.repair.orderbot.service.business.IReminderRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryReminderRepository implements IReminderRepository {

    private final Map<Long, ManualReminder> reminders = new LinkedHashMap<>();
    private long sequence;

    @Override
    public ManualReminder create(ManualReminder reminder) {
        ManualReminder stored = ManualReminder.builder()
                .id(++sequence)
                .firesAt(reminder.getFiresAt())
                .message(reminder.getMessage())
                .targetChannel(reminder.getTargetChannel())
                .businessId(reminder.getBusinessId())
                .status(ReminderStatus.PENDING)
                .build();
        reminders.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public Optional<ManualReminder> findById(Long id) {
        return Optional.ofNullable(reminders.get(id)).map(this::copy);
    }

    @Override
    public List<ManualReminder> findDue(Instant now) {
        return reminders.values().stream()
                .filter(r -> r.getStatus() == ReminderStatus.PENDING && !r.getFiresAt().isAfter(now))
                .sorted(Comparator.comparing(ManualReminder::getFiresAt))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean transition(Long id, ReminderStatus from, ReminderStatus to, Instant at) {
        ManualReminder stored = reminders.get(id);
        if (stored == null || stored.getStatus() != from) {
            return false;
        }
        stored.setStatus(to);
        if (to == ReminderStatus.FIRED) {
            stored.setFiredAt(at);
        }
        return true;
    }

    @Override
    public int cancelAllFor(String businessId) {
        int count = 0;
        for (ManualReminder reminder : reminders.values()) {
            if (businessId.equals(reminder.getBusinessId()) && reminder.getStatus() == ReminderStatus.PENDING) {
                reminder.setStatus(ReminderStatus.CANCELLED);
                count++;
            }
        }
        return count;
    }

    @Override
    public int retarget(String oldBusinessId, String newBusinessId) {
        int count = 0;
        for (ManualReminder reminder : reminders.values()) {
            if (oldBusinessId.equals(reminder.getBusinessId()) && reminder.getStatus() == ReminderStatus.PENDING) {
                reminder.setBusinessId(newBusinessId);
                count++;
            }
        }
        return count;
    }

    @Override
    public List<ManualReminder> findPending(String channel) {
        return reminders.values().stream()
                .filter(r -> r.getStatus() == ReminderStatus.PENDING)
                .filter(r -> channel == null || channel.equals(r.getTargetChannel()))
                .sorted(Comparator.comparing(ManualReminder::getFiresAt))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ManualReminder> findPendingFor(String businessId) {
        return reminders.values().stream()
                .filter(r -> r.getStatus() == ReminderStatus.PENDING && businessId.equals(r.getBusinessId()))
                .sorted(Comparator.comparing(ManualReminder::getFiresAt))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    private ManualReminder copy(ManualReminder r) {
        return ManualReminder.builder()
                .id(r.getId())
                .firesAt(r.getFiresAt())
                .message(r.getMessage())
                .targetChannel(r.getTargetChannel())
                .businessId(r.getBusinessId())
                .status(r.getStatus())
                .createdAt(r.getCreatedAt())
                .firedAt(r.getFiredAt())
                .build();
    }
}
