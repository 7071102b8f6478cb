package com.foo.tariff.config;

import org.springframework.stereotype.Component;

/** 기본 워크북 레이아웃: 1행 헤더, 2행부터 데이터, "※" 이후는 주석. */
@Component
public class DefaultScheduleWorkbookConfig implements ScheduleWorkbookConfig {}
