package kr.socialcredit.economy.domain.gacha;

public class ContainerNotFoundException extends RuntimeException {

    public ContainerNotFoundException(String containerId) {
        super("존재하지 않는 케이스입니다: " + containerId);
    }
}
