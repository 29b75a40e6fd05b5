package com.furniture.workshop.util;

import com.furniture.workshop.config.WorkshopProperties;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class Messages {

    private final MessageSource messageSource;
    private final Locale locale;

    public Messages(MessageSource messageSource, WorkshopProperties properties) {
        this.messageSource = messageSource;
        this.locale = Locale.forLanguageTag(properties.getLocale());
    }

    public String get(String key, Object... args) {
        return messageSource.getMessage(key, args, key, locale);
    }
}
