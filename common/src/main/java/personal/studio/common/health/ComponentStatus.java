package personal.studio.common.health;

/**
 * 인프라 구성 요소 상태
 */
public enum ComponentStatus {
    UP,
    DOWN;

    public boolean isUp() {
        return this == UP;
    }
}
