package com.repair.orderbot.service.notify;

/**
 * 主动推送通道（截止日期预警、手动提醒）
 */
public interface Notifier {

    /**
     * @param channel 投递地址，核心不解析
     * @throws com.repair.orderbot.exception.NotificationException 投递失败
     */
    void send(String channel, String text);
}
