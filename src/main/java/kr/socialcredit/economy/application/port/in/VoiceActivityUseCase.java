package kr.socialcredit.economy.application.port.in;

public interface VoiceActivityUseCase {

    /**
     * 음성 채널 입장 (채널 이동은 입장으로 다시 세지 않음)
     */
    void joined(String userId);

    /**
     * 음성 채널 퇴장. 남은 체류 시간을 정산하고 추적을 멈춘다.
     */
    void left(String userId);

    /**
     * 추적 중인 모든 사용자의 체류 시간과 보상을 저장
     *
     * @return 저장에 성공한 사용자 수
     */
    int settleAll();

    int trackedCount();
}
