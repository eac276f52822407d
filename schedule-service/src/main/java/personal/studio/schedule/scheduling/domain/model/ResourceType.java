package personal.studio.schedule.scheduling.domain.model;

import java.util.Locale;

/**
 * 중복 예약을 검사하는 자원 종류
 */
public enum ResourceType {
    TEACHER,
    ROOM,
    STUDENT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
