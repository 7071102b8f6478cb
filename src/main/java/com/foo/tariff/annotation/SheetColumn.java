package com.foo.tariff.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 요율표 워크북 시트의 컬럼과 행 DTO 필드를 잇는다. 컬럼 위치는 헤더 행에서 찾는다.
 *
 * <p>헤더는 대소문자를 무시하고 비교하며, "effective_from (yyyy-MM-dd)"처럼 뒤에 안내 문구가 붙어도 매칭된다.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface SheetColumn {

    /** 헤더 행에서 찾을 텍스트. 오류 메시지의 컬럼 표시에도 쓴다. */
    String header();

    /** LocalDate 필드를 문자열 셀에서 읽을 때의 형식. */
    String dateFormat() default "yyyy-MM-dd";

    /** false이면 헤더가 없어도 오류가 아니며 필드는 null로 남는다. */
    boolean required() default true;
}
