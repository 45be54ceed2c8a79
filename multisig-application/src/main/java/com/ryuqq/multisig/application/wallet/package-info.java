/**
 * MultiSig Application Layer - 지갑 연산 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.application.wallet.MultiSigWallet} - propose / approve / execute 및 조회 연산</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 multisig-engine 모듈에 위치</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
package com.ryuqq.multisig.application.wallet;
