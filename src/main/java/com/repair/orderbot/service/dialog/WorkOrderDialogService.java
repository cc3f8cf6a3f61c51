package com.repair.orderbot.service.dialog;

import com.repair.orderbot.exception.DuplicateWorkOrderException;
import com.repair.orderbot.exception.ExtractionException;
import com.repair.orderbot.exception.NotFoundException;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.exception.SchedulingException;
import com.repair.orderbot.exception.ValidationException;
import com.repair.orderbot.model.dto.ChoiceOption;
import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.TurnInput;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.ActionType;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.FieldType;
import com.repair.orderbot.model.enums.InputKind;
import com.repair.orderbot.model.enums.LabeledChoice;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.OrderStatus;
import com.repair.orderbot.model.enums.WorkflowState;
import com.repair.orderbot.service.business.IWorkOrderRepository;
import com.repair.orderbot.service.extract.DocumentFieldExtractor;
import com.repair.orderbot.service.notify.ChatGateway;
import com.repair.orderbot.service.reminder.ReminderScheduler;
import com.repair.orderbot.service.schema.FieldSchema;
import com.repair.orderbot.service.schema.FieldValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工单对话状态机
 * 每轮输入在会话锁内处理，同一会话的输入严格按到达顺序执行
 */
@Slf4j
@Service
public class WorkOrderDialogService {

    public static final DateTimeFormatter REMINDER_INPUT = DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String ALL = "ALL";

    private final SessionRegistry sessionRegistry;
    private final IWorkOrderRepository workOrderRepository;
    private final ReminderScheduler reminderScheduler;
    private final FieldValidator fieldValidator;
    private final DocumentFieldExtractor documentFieldExtractor;
    private final WorkOrderFormatter formatter;
    private final ChatGateway chatGateway;
    private final Clock clock;

    public WorkOrderDialogService(SessionRegistry sessionRegistry,
                                  IWorkOrderRepository workOrderRepository,
                                  ReminderScheduler reminderScheduler,
                                  FieldValidator fieldValidator,
                                  DocumentFieldExtractor documentFieldExtractor,
                                  WorkOrderFormatter formatter,
                                  ChatGateway chatGateway,
                                  Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.workOrderRepository = workOrderRepository;
        this.reminderScheduler = reminderScheduler;
        this.fieldValidator = fieldValidator;
        this.documentFieldExtractor = documentFieldExtractor;
        this.formatter = formatter;
        this.chatGateway = chatGateway;
        this.clock = clock;
    }

    /**
     * 处理一轮输入
     * @param sessionId 会话ID
     * @param channel 回复通道
     * @return 处理后的会话状态
     */
    public WorkflowState handle(String sessionId, String channel, TurnInput input) {
        Session session = sessionRegistry.getOrCreate(sessionId, channel);
        synchronized (session) {
            session.setLastActiveAt(clock.instant());
            WorkflowState before = session.getState();
            try {
                route(session, input);
            } catch (PersistenceException e) {
                log.error("存储异常，当前操作终止：sessionId={}, state={}, error={}",
                        sessionId, before, e.getMessage(), e);
                session.reset();
                reply(session, "❌ 操作失败：数据存储暂不可用，请稍后重试。已保存的内容不受影响。");
                prompt(session);
            }
            log.debug("会话状态迁移：sessionId={}, {} -> {}", sessionId, before, session.getState());
            return session.getState();
        }
    }

    private void route(Session session, TurnInput input) {
        if (input == null || input.getKind() == null) {
            invalidInput(session);
            return;
        }
        if (isCancel(input)) {
            cancel(session);
            return;
        }
        if (input.getKind() == InputKind.COMMAND) {
            onCommand(session, input.getCommand());
            return;
        }
        if (input.getKind() == InputKind.ACTION && !WorkflowTransitions.permits(session.getState(), input.getAction())) {
            // 过期按钮或无法识别的回调数据
            invalidInput(session);
            return;
        }

        try {
            dispatch(session, input);
        } catch (ValidationException | NotFoundException e) {
            reply(session, "⚠️ " + e.getMessage());
            prompt(session);
        }
    }

    private void dispatch(Session session, TurnInput input) {
        switch (session.getState()) {
            case MENU:
                onMenu(session, input);
                break;
            case COLLECT_IDENTIFIER:
                onCollectIdentifier(session, input);
                break;
            case COLLECT_FIELD:
                onCollectField(session, input);
                break;
            case DUPLICATE_CHOICE:
                onDuplicateChoice(session, input);
                break;
            case CONFIRM_SUMMARY:
                onConfirmSummary(session, input);
                break;
            case LOOKUP_FOR_UPDATE:
                onLookupForUpdate(session, input);
                break;
            case FIELD_EDIT_MENU:
                onFieldEditMenu(session, input);
                break;
            case AWAIT_FIELD_VALUE:
                onAwaitFieldValue(session, input);
                break;
            case LOOKUP_FOR_DELETE:
                onLookupForDelete(session, input);
                break;
            case CONFIRM_DELETE:
                onConfirmDelete(session, input);
                break;
            case FILTER_CATEGORY:
                onFilterCategory(session, input);
                break;
            case FILTER_STATUS:
                onFilterStatus(session, input);
                break;
            case AWAIT_DOCUMENT:
                onAwaitDocument(session, input);
                break;
            case REMINDER_LOOKUP:
                onReminderLookup(session, input);
                break;
            case REMINDER_TIME:
                onReminderTime(session, input);
                break;
            case REMINDER_MESSAGE:
                onReminderMessage(session, input);
                break;
            default:
                throw new IllegalStateException("未处理的会话状态：" + session.getState());
        }
    }

    // ------------------------------------------------------------------ 命令与取消

    private boolean isCancel(TurnInput input) {
        return input.isAction(ActionType.CANCEL)
                || (input.getKind() == InputKind.COMMAND && "cancel".equalsIgnoreCase(input.getCommand()));
    }

    private void cancel(Session session) {
        WorkOrder draft = session.getDraft();
        boolean hadWork = session.getState() != WorkflowState.MENU;
        session.reset();
        if (hadWork) {
            String note = draft != null && draft.isPersisted() ? "（已保存的修改不会撤销）" : "";
            reply(session, "已取消当前操作" + note + "。");
        }
        prompt(session);
    }

    private void onCommand(Session session, String command) {
        String name = command != null ? command.toLowerCase() : "";
        switch (name) {
            case "start":
            case "menu":
                session.reset();
                prompt(session);
                break;
            case "help":
                reply(session, helpText());
                prompt(session);
                break;
            default:
                reply(session, "未知命令：/" + name + "，可用命令：/start /menu /cancel /help");
                prompt(session);
                break;
        }
    }

    private void invalidInput(Session session) {
        reply(session, "⚠️ 无效的操作，请按提示重新选择。");
        prompt(session);
    }

    // ------------------------------------------------------------------ 主菜单

    private void onMenu(Session session, TurnInput input) {
        if (input.getKind() != InputKind.ACTION) {
            prompt(session);
            return;
        }
        ActionType action = input.getAction();
        if (action == ActionType.HELP) {
            reply(session, helpText());
        }
        if (action == ActionType.REMIND) {
            session.setReminderBusinessId(null);
        }
        moveTo(session, WorkflowTransitions.target(session.getState(), action));
    }

    // ------------------------------------------------------------------ 新建

    private void onCollectIdentifier(Session session, TurnInput input) {
        String businessId = fieldValidator.normalizeIdentifier(requireText(input, "请输入工单编号"));
        Optional<WorkOrder> existing = workOrderRepository.findByBusinessId(businessId);
        if (existing.isPresent()) {
            session.setDuplicate(existing.get());
            moveTo(session, WorkflowState.DUPLICATE_CHOICE);
            return;
        }

        WorkOrder draft = new WorkOrder();
        draft.put(FieldKey.IDENTIFIER, FieldValue.text(businessId));
        draft.setNotifyChannel(session.getChannel());
        session.setDraft(draft);
        advanceCollect(session, 0);
    }

    private void onCollectField(Session session, TurnInput input) {
        FieldKey key = FieldSchema.requiredFields().get(session.getCollectIndex());
        session.getDraft().put(key, readValue(key, input));
        advanceCollect(session, session.getCollectIndex() + 1);
    }

    /**
     * 跳过已有值的必填字段，全部填写后进入确认页
     */
    private void advanceCollect(Session session, int fromIndex) {
        int next = FieldSchema.nextMissingRequired(session.getDraft(), fromIndex);
        if (next < 0) {
            FieldSchema.applyDefaults(session.getDraft());
            moveTo(session, WorkflowState.CONFIRM_SUMMARY);
            return;
        }
        session.setCollectIndex(next);
        moveTo(session, WorkflowState.COLLECT_FIELD);
    }

    private void onDuplicateChoice(Session session, TurnInput input) {
        if (!input.isAction(ActionType.EDIT_EXISTING)) {
            prompt(session);
            return;
        }
        session.setDraft(session.getDuplicate());
        session.setDuplicate(null);
        moveTo(session, WorkflowTransitions.target(session.getState(), ActionType.EDIT_EXISTING));
    }

    private void onConfirmSummary(Session session, TurnInput input) {
        if (input.getKind() != InputKind.ACTION) {
            prompt(session);
            return;
        }
        if (input.getAction() == ActionType.EDIT) {
            moveTo(session, WorkflowTransitions.target(session.getState(), ActionType.EDIT));
            return;
        }

        try {
            WorkOrder created = workOrderRepository.create(session.getDraft());
            reply(session, "✅ 工单 " + created.getBusinessId() + " 已创建。");
            session.reset();
            moveTo(session, WorkflowTransitions.target(WorkflowState.CONFIRM_SUMMARY, ActionType.CONFIRM));
        } catch (DuplicateWorkOrderException e) {
            log.info("确认创建时编号已被占用：businessId={}", session.getDraft().getBusinessId());
            session.setDuplicate(e.getExisting());
            session.setDraft(null);
            if (e.getExisting() == null) {
                reply(session, "⚠️ " + e.getMessage());
                session.reset();
                prompt(session);
                return;
            }
            moveTo(session, WorkflowState.DUPLICATE_CHOICE);
        }
    }

    // ------------------------------------------------------------------ 修改

    private void onLookupForUpdate(Session session, TurnInput input) {
        session.setDraft(lookup(input));
        moveTo(session, WorkflowState.FIELD_EDIT_MENU);
    }

    private void onFieldEditMenu(Session session, TurnInput input) {
        if (input.getKind() != InputKind.ACTION) {
            prompt(session);
            return;
        }
        if (input.getAction() == ActionType.FINISH) {
            if (session.getDraft().isPersisted()) {
                reply(session, "✅ 工单 " + session.getDraft().getBusinessId() + " 的修改已保存。");
                session.reset();
                moveTo(session, WorkflowTransitions.target(WorkflowState.FIELD_EDIT_MENU, ActionType.FINISH));
            } else {
                moveTo(session, WorkflowState.CONFIRM_SUMMARY);
            }
            return;
        }

        FieldKey key;
        try {
            key = FieldKey.valueOf(String.valueOf(input.getArgument()));
        } catch (IllegalArgumentException e) {
            invalidInput(session);
            return;
        }
        session.setEditingField(key);
        moveTo(session, WorkflowState.AWAIT_FIELD_VALUE);
    }

    private void onAwaitFieldValue(Session session, TurnInput input) {
        FieldKey key = session.getEditingField();
        FieldValue value = readValue(key, input);
        WorkOrder order = session.getDraft();

        if (!order.isPersisted()) {
            order.put(key, value);
            session.setEditingField(null);
            moveTo(session, WorkflowState.FIELD_EDIT_MENU);
            return;
        }

        // 已入库工单：逐字段立即保存
        String oldId = order.getBusinessId();
        Map<FieldKey, FieldValue> changes = new EnumMap<>(FieldKey.class);
        changes.put(key, value);
        WorkOrder updated;
        try {
            updated = workOrderRepository.update(oldId, changes);
        } catch (DuplicateWorkOrderException e) {
            throw new ValidationException("工单编号 " + value.render() + " 已被占用，请输入其他编号");
        } catch (NotFoundException e) {
            reply(session, "⚠️ 工单 " + oldId + " 已不存在，可能已被删除。");
            session.reset();
            prompt(session);
            return;
        }

        String newId = updated.getBusinessId();
        if (key == FieldKey.IDENTIFIER && !oldId.equals(newId)) {
            reminderScheduler.retarget(oldId, newId);
        }
        session.setDraft(updated);
        session.setEditingField(null);
        reply(session, "✅ " + key.getLabel() + " 已更新为：" + value.render());
        moveTo(session, WorkflowState.FIELD_EDIT_MENU);
    }

    // ------------------------------------------------------------------ 删除

    private void onLookupForDelete(Session session, TurnInput input) {
        session.setDraft(lookup(input));
        moveTo(session, WorkflowState.CONFIRM_DELETE);
    }

    private void onConfirmDelete(Session session, TurnInput input) {
        if (!input.isAction(ActionType.CONFIRM)) {
            prompt(session);
            return;
        }
        String businessId = session.getDraft().getBusinessId();
        if (workOrderRepository.delete(businessId)) {
            int cancelled = reminderScheduler.cancelAllFor(businessId);
            String note = cancelled > 0 ? "，并取消了 " + cancelled + " 条关联提醒" : "";
            reply(session, "🗑️ 工单 " + businessId + " 已删除" + note + "。");
        } else {
            reply(session, "⚠️ 工单 " + businessId + " 已不存在。");
        }
        session.reset();
        moveTo(session, WorkflowTransitions.target(WorkflowState.CONFIRM_DELETE, ActionType.CONFIRM));
    }

    // ------------------------------------------------------------------ 列表

    private void onFilterCategory(Session session, TurnInput input) {
        if (input.getKind() != InputKind.ACTION) {
            prompt(session);
            return;
        }
        String token = input.getArgument();
        if (ALL.equals(token)) {
            session.setFilterCategory(null);
        } else {
            session.setFilterCategory((OrderCategory) fieldValidator.parseChoiceToken(FieldKey.CATEGORY, token).getChoice());
        }
        moveTo(session, WorkflowTransitions.target(session.getState(), ActionType.CHOOSE));
    }

    private void onFilterStatus(Session session, TurnInput input) {
        if (input.getKind() != InputKind.ACTION) {
            prompt(session);
            return;
        }
        String token = input.getArgument();
        OrderStatus status = ALL.equals(token)
                ? null
                : (OrderStatus) fieldValidator.parseChoiceToken(FieldKey.STATUS, token).getChoice();

        List<WorkOrder> orders = workOrderRepository.query(session.getFilterCategory(), status);
        if (orders.isEmpty()) {
            reply(session, "没有符合条件的工单。");
        } else {
            List<String> items = new ArrayList<>();
            for (WorkOrder order : orders) {
                items.add(formatter.listItem(order));
            }
            for (String message : formatter.chunk("共 " + orders.size() + " 条工单（按截止日期排序）：", items)) {
                reply(session, message);
            }
        }
        session.reset();
        moveTo(session, WorkflowTransitions.target(WorkflowState.FILTER_STATUS, ActionType.CHOOSE));
    }

    // ------------------------------------------------------------------ 文档上传

    private void onAwaitDocument(Session session, TurnInput input) {
        if (input.getKind() != InputKind.DOCUMENT) {
            reply(session, "请发送工单文档文件。");
            prompt(session);
            return;
        }

        Map<FieldKey, String> extracted;
        try {
            extracted = documentFieldExtractor.extract(
                    input.getDocumentContent(), input.getDocumentName(), input.getDocumentMimeType());
        } catch (ExtractionException e) {
            log.warn("文档解析失败：sessionId={}, fileName={}, error={}",
                    session.getSessionId(), input.getDocumentName(), e.getMessage());
            reply(session, "⚠️ 文档解析失败：" + e.getMessage());
            prompt(session);
            return;
        }

        String businessId;
        try {
            businessId = fieldValidator.normalizeIdentifier(extracted.get(FieldKey.IDENTIFIER));
        } catch (ValidationException e) {
            reply(session, "❌ 文档中没有找到有效的工单编号，请改用手动新建。");
            session.reset();
            prompt(session);
            return;
        }

        Optional<WorkOrder> existing = workOrderRepository.findByBusinessId(businessId);
        if (existing.isPresent()) {
            session.setDuplicate(existing.get());
            moveTo(session, WorkflowState.DUPLICATE_CHOICE);
            return;
        }

        WorkOrder draft = new WorkOrder();
        draft.setNotifyChannel(session.getChannel());
        List<String> rejected = new ArrayList<>();
        for (Map.Entry<FieldKey, String> entry : extracted.entrySet()) {
            try {
                draft.put(entry.getKey(), fieldValidator.parse(entry.getKey(), entry.getValue()));
            } catch (ValidationException e) {
                rejected.add(entry.getKey().getLabel() + "（" + entry.getValue() + "）");
            }
        }
        session.setDraft(draft);

        StringBuilder text = new StringBuilder("📄 已从文档读取 ")
                .append(extracted.size() - rejected.size()).append(" 个字段。");
        if (!rejected.isEmpty()) {
            text.append("\n以下字段无效，需要重新填写：").append(String.join("、", rejected));
        }
        reply(session, text.toString());
        advanceCollect(session, 0);
    }

    // ------------------------------------------------------------------ 提醒

    private void onReminderLookup(Session session, TurnInput input) {
        if (input.isAction(ActionType.NO_ORDER)) {
            session.setReminderBusinessId(null);
            moveTo(session, WorkflowTransitions.target(session.getState(), ActionType.NO_ORDER));
            return;
        }
        session.setReminderBusinessId(lookup(input).getBusinessId());
        moveTo(session, WorkflowState.REMINDER_TIME);
    }

    private void onReminderTime(Session session, TurnInput input) {
        String raw = requireText(input, "请输入提醒时间").trim();
        Instant firesAt;
        try {
            firesAt = LocalDateTime.parse(raw, REMINDER_INPUT).atZone(clock.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("时间格式无效，请使用 DD/MM/AAAA HH:mm（例如 25/10/2025 14:30）");
        }
        try {
            reminderScheduler.checkFiresAt(firesAt);
        } catch (SchedulingException e) {
            throw new ValidationException(e.getMessage());
        }
        session.setReminderFiresAt(firesAt);
        moveTo(session, WorkflowState.REMINDER_MESSAGE);
    }

    private void onReminderMessage(Session session, TurnInput input) {
        String message = requireText(input, "请输入提醒内容").trim();
        if (message.isEmpty()) {
            throw new ValidationException("提醒内容不能为空");
        }
        try {
            Long id = reminderScheduler.schedule(session.getReminderFiresAt(), message,
                    session.getChannel(), session.getReminderBusinessId());
            log.info("会话设置提醒：sessionId={}, reminderId={}", session.getSessionId(), id);
        } catch (SchedulingException e) {
            // 输入时间后停留过久，时间已过
            reply(session, "⚠️ " + e.getMessage());
            moveTo(session, WorkflowState.REMINDER_TIME);
            return;
        }
        String when = LocalDateTime.ofInstant(session.getReminderFiresAt(), clock.getZone()).format(REMINDER_INPUT);
        reply(session, "⏰ 提醒已设置：" + when);
        session.reset();
        prompt(session);
    }

    // ------------------------------------------------------------------ 公共

    private WorkOrder lookup(TurnInput input) {
        String businessId = fieldValidator.normalizeIdentifier(requireText(input, "请输入工单编号"));
        return workOrderRepository.findByBusinessId(businessId)
                .orElseThrow(() -> new NotFoundException(businessId));
    }

    /**
     * 读取字段值：固定选项只接受按钮，其余只接受文本
     */
    private FieldValue readValue(FieldKey key, TurnInput input) {
        if (key.getType() == FieldType.CHOICE) {
            if (!input.isAction(ActionType.CHOOSE)) {
                throw new ValidationException(key.getLabel() + "请点击下方按钮选择");
            }
            return fieldValidator.parseChoiceToken(key, input.getArgument());
        }
        return fieldValidator.parse(key, requireText(input, "请输入" + key.getLabel()));
    }

    private String requireText(TurnInput input, String hint) {
        if (input.getKind() != InputKind.TEXT || input.getText() == null) {
            throw new ValidationException(hint);
        }
        return input.getText();
    }

    private void moveTo(Session session, WorkflowState state) {
        session.setState(state);
        prompt(session);
    }

    private void reply(Session session, String text) {
        chatGateway.sendPrompt(session.getChannel(), text, Collections.emptyList());
    }

    /**
     * 发送当前状态的提示
     */
    private void prompt(Session session) {
        switch (session.getState()) {
            case MENU:
                send(session, "请选择操作：", menuChoices());
                break;
            case COLLECT_IDENTIFIER:
                send(session, "请输入工单编号（纯数字）：", cancelOnly());
                break;
            case COLLECT_FIELD:
                FieldKey key = FieldSchema.requiredFields().get(session.getCollectIndex());
                send(session, fieldPrompt(key, null), fieldChoices(key));
                break;
            case DUPLICATE_CHOICE:
                WorkOrder existing = session.getDuplicate();
                send(session, "⚠️ 工单 " + existing.getBusinessId() + " 已存在：\n\n" + orderSummary(existing),
                        List.of(option("✏️ 编辑该工单", ActionType.EDIT_EXISTING, null),
                                option("取消", ActionType.CANCEL, null)));
                break;
            case CONFIRM_SUMMARY:
                send(session, "请确认工单信息：\n\n" + formatter.summary(session.getDraft()),
                        List.of(option("✅ 确认", ActionType.CONFIRM, null),
                                option("✏️ 修改", ActionType.EDIT, null),
                                option("取消", ActionType.CANCEL, null)));
                break;
            case LOOKUP_FOR_UPDATE:
                send(session, "请输入要修改的工单编号：", cancelOnly());
                break;
            case FIELD_EDIT_MENU:
                send(session, "工单 " + session.getDraft().getBusinessId() + "，请选择要修改的字段："
                                + reminderNotes(session.getDraft()),
                        editMenuChoices(session.getDraft()));
                break;
            case AWAIT_FIELD_VALUE:
                FieldKey editing = session.getEditingField();
                send(session, fieldPrompt(editing, formatter.value(session.getDraft(), editing)), fieldChoices(editing));
                break;
            case LOOKUP_FOR_DELETE:
                send(session, "请输入要删除的工单编号：", cancelOnly());
                break;
            case CONFIRM_DELETE:
                send(session, "确认删除以下工单？\n\n" + orderSummary(session.getDraft()),
                        List.of(option("🗑️ 确认删除", ActionType.CONFIRM, null),
                                option("取消", ActionType.CANCEL, null)));
                break;
            case FILTER_CATEGORY:
                send(session, "按工单类型筛选：", filterChoices(FieldKey.CATEGORY));
                break;
            case FILTER_STATUS:
                send(session, "按状态筛选：", filterChoices(FieldKey.STATUS));
                break;
            case AWAIT_DOCUMENT:
                send(session, "请发送工单文档（PDF 或文本格式）：", cancelOnly());
                break;
            case REMINDER_LOOKUP:
                send(session, "请输入提醒关联的工单编号，或选择不关联工单：",
                        List.of(option("不关联工单", ActionType.NO_ORDER, null),
                                option("取消", ActionType.CANCEL, null)));
                break;
            case REMINDER_TIME:
                send(session, "请输入提醒时间（DD/MM/AAAA HH:mm）：", cancelOnly());
                break;
            case REMINDER_MESSAGE:
                send(session, "请输入提醒内容：", cancelOnly());
                break;
            default:
                throw new IllegalStateException("未处理的会话状态：" + session.getState());
        }
    }

    private String orderSummary(WorkOrder order) {
        return formatter.summary(order) + reminderNotes(order);
    }

    /**
     * 已入库工单附带其待触发提醒
     */
    private String reminderNotes(WorkOrder order) {
        if (order == null || !order.isPersisted()) {
            return "";
        }
        return formatter.pendingReminders(reminderScheduler.pendingFor(order.getBusinessId()), clock.getZone());
    }

    private void send(Session session, String text, List<ChoiceOption> choices) {
        chatGateway.sendPrompt(session.getChannel(), text, choices);
    }

    private String fieldPrompt(FieldKey key, String current) {
        StringBuilder text = new StringBuilder();
        text.append(key.getType() == FieldType.CHOICE ? "请选择" : "请输入").append(key.getLabel());
        if (key.getType() == FieldType.DATE) {
            text.append(key.isUnsetAllowed() ? "（DD/MM/AAAA，或 N/A）" : "（DD/MM/AAAA）");
        }
        if (current != null) {
            text.append("\n当前值：").append(current);
        }
        return text.append("：").toString();
    }

    private List<ChoiceOption> menuChoices() {
        return List.of(
                option("📝 新建工单", ActionType.CREATE, null),
                option("✏️ 修改工单", ActionType.UPDATE, null),
                option("🗑️ 删除工单", ActionType.DELETE, null),
                option("📋 查看工单", ActionType.LIST, null),
                option("📄 上传文档", ActionType.UPLOAD, null),
                option("⏰ 设置提醒", ActionType.REMIND, null),
                option("❓ 帮助", ActionType.HELP, null));
    }

    private List<ChoiceOption> fieldChoices(FieldKey key) {
        List<ChoiceOption> choices = new ArrayList<>();
        for (LabeledChoice choice : FieldSchema.choicesFor(key)) {
            choices.add(option(choice.getLabel(), ActionType.CHOOSE, choice.name()));
        }
        choices.add(option("取消", ActionType.CANCEL, null));
        return choices;
    }

    private List<ChoiceOption> filterChoices(FieldKey key) {
        List<ChoiceOption> choices = new ArrayList<>();
        for (LabeledChoice choice : FieldSchema.choicesFor(key)) {
            choices.add(option(choice.getLabel(), ActionType.CHOOSE, choice.name()));
        }
        choices.add(option("全部", ActionType.CHOOSE, ALL));
        return choices;
    }

    private List<ChoiceOption> editMenuChoices(WorkOrder order) {
        List<ChoiceOption> choices = new ArrayList<>();
        for (FieldKey key : FieldSchema.editableFields()) {
            choices.add(option(key.getLabel() + "：" + formatter.value(order, key), ActionType.PICK_FIELD, key.name()));
        }
        choices.add(option("✅ 完成", ActionType.FINISH, null));
        return choices;
    }

    private List<ChoiceOption> cancelOnly() {
        return List.of(option("取消", ActionType.CANCEL, null));
    }

    private ChoiceOption option(String label, ActionType action, String argument) {
        return new ChoiceOption(label, CallbackData.encode(action, argument));
    }

    private String helpText() {
        return "📖 使用说明\n"
                + "新建工单：按顺序填写必填字段，确认后保存；编号已存在时可直接编辑原工单。\n"
                + "修改工单：输入编号后选择字段，每次修改立即保存。\n"
                + "删除工单：删除后关联的提醒一并取消。\n"
                + "查看工单：按类型和状态筛选，按截止日期排序。\n"
                + "上传文档：从工单 PDF 或导出文件读取字段，缺失的再手动补充。\n"
                + "设置提醒：指定时间推送一条提醒，可关联工单。\n"
                + "截止日期预警每天自动推送（逾期、今日、明日、两天后到期）。\n"
                + "命令：/start /menu 返回主菜单，/cancel 取消当前操作。";
    }
}
