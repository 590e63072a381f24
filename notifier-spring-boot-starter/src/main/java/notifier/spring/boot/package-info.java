/**
 * Spring Boot auto-configuration for the notifier.
 */
package notifier.spring.boot;
