package com.study.webflux.npc.domain.ambient.model;

/** 시각에 맞는 마을 분위기 설명입니다. */
public final class AmbientScene {

	private AmbientScene() {
	}

	public static String at(int hour) {
		if (hour >= 6 && hour < 9) {
			return "이른 아침, 마을 사람들이 하나둘 하루를 시작하는 시간";
		}
		if (hour >= 9 && hour < 12) {
			return "오전, 모두 제 일에 몰두해 마을이 분주한 시간";
		}
		if (hour >= 12 && hour < 14) {
			return "점심 무렵, 사람들이 잠시 쉬며 이야기를 나누는 시간";
		}
		if (hour >= 14 && hour < 17) {
			return "오후, 다시 일을 이어가며 가끔 숨을 돌리는 시간";
		}
		if (hour >= 17 && hour < 19) {
			return "해 질 녘, 하루 일을 정리하고 내일을 준비하는 시간";
		}
		return "밤, 마을이 조용해지고 몇몇 집만 아직 불을 밝힌 시간";
	}
}
