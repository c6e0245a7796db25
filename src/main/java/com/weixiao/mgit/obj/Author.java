package com.weixiao.mgit.obj;

import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 作者身份：name &lt;email&gt; 秒级时间戳 ±HHMM 时区。
 */
@Value
public class Author {

    String name;
    String email;
    long epochSeconds;
    ZoneOffset offset;

    /**
     * 以当前时间、系统默认时区构造作者。
     * 身份取环境变量 GIT_AUTHOR_NAME / GIT_AUTHOR_EMAIL，未设置时用系统属性 user.name 与 user@local。
     */
    public static Author current() {
        String name = System.getenv("GIT_AUTHOR_NAME");
        if (name == null || name.isBlank()) name = System.getProperty("user.name", "user");
        String email = System.getenv("GIT_AUTHOR_EMAIL");
        if (email == null || email.isBlank()) email = name + "@local";
        Instant now = Instant.now();
        return new Author(name, email, now.getEpochSecond(), ZoneId.systemDefault().getRules().getOffset(now));
    }

    /** 格式化为 commit 头中的身份行内容，如 "u &lt;u@local&gt; 0 +0800"。 */
    public String format() {
        int totalMinutes = offset.getTotalSeconds() / 60;
        char sign = totalMinutes < 0 ? '-' : '+';
        int abs = Math.abs(totalMinutes);
        return String.format("%s <%s> %d %c%02d%02d", name, email, epochSeconds, sign, abs / 60, abs % 60);
    }
}
