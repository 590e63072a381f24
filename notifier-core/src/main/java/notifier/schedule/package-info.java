/**
 * Schedule registry and the timer that fires due schedules.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ScheduleRegistry registry = ScheduleRegistry.builder()
 *     .store(scheduleStore)
 *     .build();
 * registry.loadFromStore();
 * registry.add(ScheduleDefinition.builder()
 *     .name("nightly digest")
 *     .cron("0 2 * * *")
 *     .job(JobDescriptor.of("digest"))
 *     .build());
 *
 * SchedulerLoop loop = SchedulerLoop.builder()
 *     .registry(registry)
 *     .jobCreator(jobs::create)
 *     .build();
 * loop.start();
 * }</pre>
 */
package notifier.schedule;
