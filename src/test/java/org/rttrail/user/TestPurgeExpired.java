package org.rttrail.user;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.rttrail.test.AbstractTest;
import org.rttrail.user.db.RecoverRequestEntity;
import org.rttrail.user.db.RecoverRequestRepository;
import org.rttrail.user.db.UnconfirmedUserEntity;
import org.rttrail.user.db.UnconfirmedUserRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import reactor.test.StepVerifier;

class TestPurgeExpired extends AbstractTest {

	@Autowired private AccountService accountService;
	@Autowired private UnconfirmedUserRepository unconfirmedRepo;
	@Autowired private RecoverRequestRepository recoverRepo;
	@Autowired private R2dbcEntityTemplate r2dbc;
	
	@Test
	void testPurge() {
		long now = System.currentTimeMillis();
		long limit = now - 1000;
		var user = test.createUser();
		
		var oldPending = r2dbc.insert(new UnconfirmedUserEntity(UUID.randomUUID(), test.email(), "hash", "old-" + UUID.randomUUID(), now - 100000, limit - 1)).block();
		var recentPending = r2dbc.insert(new UnconfirmedUserEntity(UUID.randomUUID(), test.email(), "hash", "recent-" + UUID.randomUUID(), now, limit + 1)).block();
		var oldRecover = r2dbc.insert(new RecoverRequestEntity("old-" + UUID.randomUUID(), user.getEmail(), user.getId(), now - 100000, limit - 1)).block();
		var recentRecover = r2dbc.insert(new RecoverRequestEntity("recent-" + UUID.randomUUID(), user.getEmail(), user.getId(), now, limit + 1)).block();
		
		StepVerifier.create(accountService.purgeExpiredBefore(limit)).verifyComplete();
		
		assertThat(unconfirmedRepo.findById(oldPending.getId()).block()).isNull();
		assertThat(unconfirmedRepo.findById(recentPending.getId()).block()).isNotNull();
		assertThat(recoverRepo.findById(oldRecover.getResetToken()).block()).isNull();
		assertThat(recoverRepo.findById(recentRecover.getResetToken()).block()).isNotNull();
	}
	
}
