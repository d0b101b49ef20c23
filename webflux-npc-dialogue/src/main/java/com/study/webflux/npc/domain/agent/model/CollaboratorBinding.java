package com.study.webflux.npc.domain.agent.model;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 외부 협력자의 설정 여부를 표현합니다. 호출하는 쪽은 {@link #fold}로 두 경우를 모두 처리해야 합니다.
 */
public sealed interface CollaboratorBinding<T>
	permits CollaboratorBinding.Configured, CollaboratorBinding.Unconfigured {

	<R> R fold(Function<? super T, ? extends R> whenConfigured,
		Supplier<? extends R> whenUnconfigured);

	boolean isConfigured();

	static <T> CollaboratorBinding<T> configured(T handle) {
		return new Configured<>(handle);
	}

	static <T> CollaboratorBinding<T> unconfigured() {
		return new Unconfigured<>();
	}

	static <T> CollaboratorBinding<T> ofNullable(T handle) {
		return handle == null ? unconfigured() : configured(handle);
	}

	record Configured<T>(T handle) implements CollaboratorBinding<T> {

		public Configured {
			if (handle == null) {
				throw new IllegalArgumentException("handle cannot be null");
			}
		}

		@Override
		public <R> R fold(Function<? super T, ? extends R> whenConfigured,
			Supplier<? extends R> whenUnconfigured) {
			return whenConfigured.apply(handle);
		}

		@Override
		public boolean isConfigured() {
			return true;
		}
	}

	record Unconfigured<T>() implements CollaboratorBinding<T> {

		@Override
		public <R> R fold(Function<? super T, ? extends R> whenConfigured,
			Supplier<? extends R> whenUnconfigured) {
			return whenUnconfigured.get();
		}

		@Override
		public boolean isConfigured() {
			return false;
		}
	}
}
